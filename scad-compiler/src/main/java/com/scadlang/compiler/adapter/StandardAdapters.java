package com.scadlang.compiler.adapter;

import com.scadlang.compiler.adapter.node.ControlFlowAdapters;
import com.scadlang.compiler.adapter.node.CsgAdapters;
import com.scadlang.compiler.adapter.node.DeclarationAdapters;
import com.scadlang.compiler.adapter.node.ExpressionAdapters;
import com.scadlang.compiler.adapter.node.PrimitiveAdapters;
import com.scadlang.compiler.adapter.node.TransformAdapters;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 启动时构建的标准适配表，每个 {@link NodeKind} 都有对应条目
 */
final class StandardAdapters {

    static final AdapterRegistry REGISTRY = build();

    private StandardAdapters() {
    }

    private static AdapterRegistry build() {
        AdapterRegistry.Builder builder = AdapterRegistry.builder();
        for (NodeKind kind : NodeKind.values()) {
            builder.register(kind, adapterFor(kind));
        }
        return builder.build();
    }

    static NodeAdapter adapterFor(NodeKind kind) {
        switch (kind) {
            case PROGRAM: return ControlFlowAdapters::program;
            case UNKNOWN: return UnknownAdapter.INSTANCE;

            // 表达式
            case LITERAL_EXPRESSION: return ExpressionAdapters::literal;
            case IDENTIFIER_EXPRESSION: return ExpressionAdapters::identifier;
            case BINARY_EXPRESSION: return ExpressionAdapters::binary;
            case UNARY_EXPRESSION: return ExpressionAdapters::unary;
            case CONDITIONAL_EXPRESSION: return ExpressionAdapters::conditional;
            case CALL_EXPRESSION: return ExpressionAdapters::call;
            case VECTOR_EXPRESSION: return ExpressionAdapters::vector;
            case RANGE_EXPRESSION: return ExpressionAdapters::range;

            // 几何体
            case CUBE: return PrimitiveAdapters::cube;
            case SPHERE: return PrimitiveAdapters::sphere;
            case CYLINDER: return PrimitiveAdapters::cylinder;
            case POLYHEDRON: return PrimitiveAdapters::polyhedron;
            case CIRCLE: return PrimitiveAdapters::circle;
            case SQUARE: return PrimitiveAdapters::square;
            case POLYGON: return PrimitiveAdapters::polygon;

            // 变换
            case TRANSLATE: return TransformAdapters::translate;
            case ROTATE: return TransformAdapters::rotate;
            case SCALE: return TransformAdapters::scale;
            case MIRROR: return TransformAdapters::mirror;
            case COLOR: return TransformAdapters::color;
            case LINEAR_EXTRUDE: return TransformAdapters::linearExtrude;
            case ROTATE_EXTRUDE: return TransformAdapters::rotateExtrude;

            // 布尔运算
            case UNION: return CsgAdapters::union;
            case DIFFERENCE: return CsgAdapters::difference;
            case INTERSECTION: return CsgAdapters::intersection;
            case HULL: return CsgAdapters::hull;
            case MINKOWSKI: return CsgAdapters::minkowski;

            // 语句
            case BLOCK_STATEMENT: return ControlFlowAdapters::block;
            case IF_STATEMENT: return ControlFlowAdapters::ifStatement;
            case FOR_STATEMENT: return ControlFlowAdapters::forStatement;
            case ASSIGNMENT_STATEMENT: return ControlFlowAdapters::assignment;
            case MODULE_DECLARATION: return DeclarationAdapters::moduleDeclaration;
            case FUNCTION_DECLARATION: return DeclarationAdapters::functionDeclaration;
            case INCLUDE_STATEMENT: return DeclarationAdapters::include;
            case USE_STATEMENT: return DeclarationAdapters::use;

            default:
                throw new IllegalStateException("no standard adapter for " + kind);
        }
    }
}
