package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 把 CST 节点归类为规范节点种类
 *
 * <p>结构性标签一一映射；{@code module_instantiation} 与 {@code call_expression}
 * 取第一个命名子节点作为被调用者，按关键词表区分几何体、变换和布尔运算。
 * 第一个命名子节点不是标识符时返回 {@link NodeKind#UNKNOWN}，不再回溯。</p>
 */
public class NodeTypeDetector {

    private static final Map<String, NodeKind> DIRECT;
    private static final Map<String, NodeKind> CALLEES;

    static {
        Map<String, NodeKind> direct = new HashMap<>();
        direct.put("program", NodeKind.PROGRAM);
        direct.put("source_file", NodeKind.PROGRAM);
        direct.put("block", NodeKind.BLOCK_STATEMENT);
        direct.put("if_statement", NodeKind.IF_STATEMENT);
        direct.put("for_statement", NodeKind.FOR_STATEMENT);
        direct.put("assignment", NodeKind.ASSIGNMENT_STATEMENT);
        direct.put("assignment_statement", NodeKind.ASSIGNMENT_STATEMENT);
        direct.put("module_definition", NodeKind.MODULE_DECLARATION);
        direct.put("function_definition", NodeKind.FUNCTION_DECLARATION);
        direct.put("include_statement", NodeKind.INCLUDE_STATEMENT);
        direct.put("use_statement", NodeKind.USE_STATEMENT);
        direct.put("binary_expression", NodeKind.BINARY_EXPRESSION);
        direct.put("unary_expression", NodeKind.UNARY_EXPRESSION);
        direct.put("conditional_expression", NodeKind.CONDITIONAL_EXPRESSION);
        direct.put("vector_expression", NodeKind.VECTOR_EXPRESSION);
        direct.put("range_expression", NodeKind.RANGE_EXPRESSION);
        direct.put("number", NodeKind.LITERAL_EXPRESSION);
        direct.put("string", NodeKind.LITERAL_EXPRESSION);
        direct.put("boolean", NodeKind.LITERAL_EXPRESSION);
        direct.put("undef", NodeKind.LITERAL_EXPRESSION);
        direct.put("identifier", NodeKind.IDENTIFIER_EXPRESSION);
        direct.put("special_variable", NodeKind.IDENTIFIER_EXPRESSION);
        DIRECT = Collections.unmodifiableMap(direct);

        Map<String, NodeKind> callees = new HashMap<>();
        // 三维
        callees.put("cube", NodeKind.CUBE);
        callees.put("sphere", NodeKind.SPHERE);
        callees.put("cylinder", NodeKind.CYLINDER);
        callees.put("polyhedron", NodeKind.POLYHEDRON);
        // 二维
        callees.put("circle", NodeKind.CIRCLE);
        callees.put("square", NodeKind.SQUARE);
        callees.put("polygon", NodeKind.POLYGON);
        // 变换
        callees.put("translate", NodeKind.TRANSLATE);
        callees.put("rotate", NodeKind.ROTATE);
        callees.put("scale", NodeKind.SCALE);
        callees.put("mirror", NodeKind.MIRROR);
        callees.put("color", NodeKind.COLOR);
        callees.put("linear_extrude", NodeKind.LINEAR_EXTRUDE);
        callees.put("rotate_extrude", NodeKind.ROTATE_EXTRUDE);
        // 布尔运算
        callees.put("union", NodeKind.UNION);
        callees.put("difference", NodeKind.DIFFERENCE);
        callees.put("intersection", NodeKind.INTERSECTION);
        callees.put("hull", NodeKind.HULL);
        callees.put("minkowski", NodeKind.MINKOWSKI);
        CALLEES = Collections.unmodifiableMap(callees);
    }

    private final boolean strictCallees;

    public NodeTypeDetector() {
        this(false);
    }

    /**
     * @param strictCallees 未识别的调用名是否归为 Unknown
     */
    public NodeTypeDetector(boolean strictCallees) {
        this.strictCallees = strictCallees;
    }

    public NodeKind detect(TreeCursor cursor) {
        return detect(cursor.currentNode());
    }

    public NodeKind detect(SyntaxNode node) {
        String type = node.getType();
        NodeKind direct = DIRECT.get(type);
        if (direct != null) {
            return direct;
        }
        if (!isCallWrapper(type)) {
            return NodeKind.UNKNOWN;
        }
        if (node.getNamedChildCount() == 0) {
            return NodeKind.UNKNOWN;
        }
        SyntaxNode callee = node.getNamedChild(0);
        if (callee.isMissing() || !"identifier".equals(callee.getType())) {
            return NodeKind.UNKNOWN;
        }
        NodeKind keyword = CALLEES.get(callee.getText());
        if (keyword != null) {
            return keyword;
        }
        return strictCallees ? NodeKind.UNKNOWN : NodeKind.CALL_EXPRESSION;
    }

    /** 需要按被调用者名称细分的通用调用节点 */
    public static boolean isCallWrapper(String type) {
        return "module_instantiation".equals(type) || "call_expression".equals(type);
    }

    /** 内建关键词对应的种类，非关键词返回 null */
    public static NodeKind keywordKind(String callee) {
        return CALLEES.get(callee);
    }
}
