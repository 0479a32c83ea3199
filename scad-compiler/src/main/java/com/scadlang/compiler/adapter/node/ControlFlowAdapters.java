package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.stmt.AssignmentStatement;
import com.scadlang.compiler.ast.stmt.BlockStatement;
import com.scadlang.compiler.ast.stmt.ForStatement;
import com.scadlang.compiler.ast.stmt.IfStatement;
import com.scadlang.compiler.ast.stmt.LoopVariable;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序、块、条件、循环与赋值
 */
public final class ControlFlowAdapters {

    private ControlFlowAdapters() {
    }

    /** 只给出位置，children 由遍历引擎统一收集 */
    public static AstNode program(TreeCursor cursor, ChildAdapter children) {
        return new Program(PositionExtractor.fromCursor(cursor), Collections.<AstNode>emptyList());
    }

    public static AstNode block(TreeCursor cursor, ChildAdapter children) {
        return new BlockStatement(PositionExtractor.fromCursor(cursor),
                CursorNavigator.adaptNamedChildren(cursor, children));
    }

    /**
     * if 语句：没有 else 时 elseBranch 为 null，{@code else ;} 同样视为没有 else
     */
    public static AstNode ifStatement(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        SyntaxNode condition = CursorNavigator.field(cursor, "condition");
        return new IfStatement(position,
                ParameterNormalizer.valueOr(children, condition, new UnknownNode(position)),
                CursorNavigator.body(cursor, children, "consequence"),
                CursorNavigator.bodyOrNull(cursor, children, "alternative"));
    }

    public static AstNode forStatement(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        List<LoopVariable> variables = new ArrayList<>();
        for (SyntaxNode assignment : CursorNavigator.childrenOfType(cursor, "for_assignment")) {
            Position varPosition = PositionExtractor.fromNode(assignment);
            SyntaxNode name = assignment.getChildByFieldName("name");
            SyntaxNode value = assignment.getChildByFieldName("value");
            variables.add(new LoopVariable(varPosition,
                    ExpressionAdapters.identifierOf(name, varPosition).getName(),
                    ParameterNormalizer.valueOr(children, present(value), new UnknownNode(varPosition))));
        }
        return new ForStatement(position, variables, CursorNavigator.body(cursor, children, "body"));
    }

    /**
     * 赋值：缺少左值时使用名为 unknown 的标识符，缺少右值时使用数字 0
     */
    public static AstNode assignment(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        SyntaxNode name = CursorNavigator.field(cursor, "name");
        SyntaxNode value = CursorNavigator.field(cursor, "value");
        return new AssignmentStatement(position,
                ExpressionAdapters.identifierOf(name, position),
                ParameterNormalizer.valueOr(children, value, LiteralExpression.number(position, 0)));
    }

    private static SyntaxNode present(SyntaxNode node) {
        return node != null && !node.isMissing() ? node : null;
    }
}
