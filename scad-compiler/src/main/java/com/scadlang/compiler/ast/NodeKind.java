package com.scadlang.compiler.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * 规范节点种类
 *
 * <p>封闭集合：新增种类时 {@code StandardAdapters} 与 {@link AstVisitor} 都必须随之更新。</p>
 */
public enum NodeKind {
    PROGRAM("Program", Family.STATEMENT),
    UNKNOWN("Unknown", Family.EXPRESSION),

    // 表达式
    LITERAL_EXPRESSION("LiteralExpression", Family.EXPRESSION),
    IDENTIFIER_EXPRESSION("IdentifierExpression", Family.EXPRESSION),
    BINARY_EXPRESSION("BinaryExpression", Family.EXPRESSION),
    UNARY_EXPRESSION("UnaryExpression", Family.EXPRESSION),
    CONDITIONAL_EXPRESSION("ConditionalExpression", Family.EXPRESSION),
    CALL_EXPRESSION("CallExpression", Family.EXPRESSION),
    VECTOR_EXPRESSION("VectorExpression", Family.EXPRESSION),
    RANGE_EXPRESSION("RangeExpression", Family.EXPRESSION),

    // 几何体
    CUBE("Cube3D", Family.PRIMITIVE),
    SPHERE("Sphere3D", Family.PRIMITIVE),
    CYLINDER("Cylinder3D", Family.PRIMITIVE),
    POLYHEDRON("Polyhedron3D", Family.PRIMITIVE),
    CIRCLE("Circle2D", Family.PRIMITIVE),
    SQUARE("Square2D", Family.PRIMITIVE),
    POLYGON("Polygon2D", Family.PRIMITIVE),

    // 变换
    TRANSLATE("TranslateTransform", Family.TRANSFORM),
    ROTATE("RotateTransform", Family.TRANSFORM),
    SCALE("ScaleTransform", Family.TRANSFORM),
    MIRROR("MirrorTransform", Family.TRANSFORM),
    COLOR("ColorTransform", Family.TRANSFORM),
    LINEAR_EXTRUDE("LinearExtrudeTransform", Family.TRANSFORM),
    ROTATE_EXTRUDE("RotateExtrudeTransform", Family.TRANSFORM),

    // 布尔运算
    UNION("UnionOperation", Family.OPERATION),
    DIFFERENCE("DifferenceOperation", Family.OPERATION),
    INTERSECTION("IntersectionOperation", Family.OPERATION),
    HULL("HullOperation", Family.OPERATION),
    MINKOWSKI("MinkowskiOperation", Family.OPERATION),

    // 语句与声明
    BLOCK_STATEMENT("BlockStatement", Family.STATEMENT),
    IF_STATEMENT("IfStatement", Family.STATEMENT),
    FOR_STATEMENT("ForStatement", Family.STATEMENT),
    ASSIGNMENT_STATEMENT("AssignmentStatement", Family.STATEMENT),
    MODULE_DECLARATION("ModuleDeclaration", Family.STATEMENT),
    FUNCTION_DECLARATION("FunctionDeclaration", Family.STATEMENT),
    INCLUDE_STATEMENT("IncludeStatement", Family.STATEMENT),
    USE_STATEMENT("UseStatement", Family.STATEMENT);

    public enum Family {
        EXPRESSION,
        PRIMITIVE,
        TRANSFORM,
        OPERATION,
        STATEMENT
    }

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_NAME.put(kind.canonicalName, kind);
        }
    }

    private final String canonicalName;
    private final Family family;

    NodeKind(String canonicalName, Family family) {
        this.canonicalName = canonicalName;
        this.family = family;
    }

    /** 规范名，如 {@code Cube3D} */
    public String getCanonicalName() {
        return canonicalName;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * 按规范名查找
     *
     * @return 对应种类，未知名称返回 {@link #UNKNOWN}
     */
    public static NodeKind fromCanonicalName(String name) {
        NodeKind kind = BY_NAME.get(name);
        return kind != null ? kind : UNKNOWN;
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
