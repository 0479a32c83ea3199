package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.expr.Argument;
import com.scadlang.compiler.ast.expr.BinaryExpression;
import com.scadlang.compiler.ast.expr.CallExpression;
import com.scadlang.compiler.ast.expr.ConditionalExpression;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.IdentifierExpression;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.expr.RangeExpression;
import com.scadlang.compiler.ast.expr.UnaryExpression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 表达式适配
 */
public final class ExpressionAdapters {
    private static final Logger LOG = Logger.getLogger(ExpressionAdapters.class.getName());

    /** 缺失的标识符使用的占位名 */
    public static final String UNKNOWN_NAME = "unknown";

    private ExpressionAdapters() {
    }

    public static AstNode literal(TreeCursor cursor, ChildAdapter children) {
        SyntaxNode node = cursor.currentNode();
        Position position = PositionExtractor.fromCursor(cursor);
        String text = node.getText();
        switch (node.getType()) {
            case "number":
                try {
                    return LiteralExpression.number(position, Double.parseDouble(text));
                } catch (NumberFormatException e) {
                    LOG.fine("无法解析数字字面量: " + text);
                    return new UnknownNode(position);
                }
            case "string":
                return LiteralExpression.string(position, unquote(text));
            case "boolean":
                return LiteralExpression.bool(position, "true".equals(text));
            default:
                return LiteralExpression.undef(position);
        }
    }

    public static AstNode identifier(TreeCursor cursor, ChildAdapter children) {
        return identifierOf(cursor.currentNode(), PositionExtractor.fromCursor(cursor));
    }

    /**
     * 标识符节点转 IdentifierExpression；节点缺失或为空时使用 {@value #UNKNOWN_NAME}
     */
    static IdentifierExpression identifierOf(SyntaxNode node, Position fallback) {
        if (node == null || node.isMissing() || node.getText().isEmpty()) {
            return new IdentifierExpression(node != null ? PositionExtractor.fromNode(node) : fallback, UNKNOWN_NAME);
        }
        return new IdentifierExpression(PositionExtractor.fromNode(node), node.getText());
    }

    public static AstNode binary(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        SyntaxNode node = cursor.currentNode();
        SyntaxNode left = CursorNavigator.field(cursor, "left");
        SyntaxNode right = CursorNavigator.field(cursor, "right");
        SyntaxNode operator = CursorNavigator.field(cursor, "operator");
        if (left == null && node.getNamedChildCount() > 0) {
            left = node.getNamedChild(0);
        }
        if (right == null && node.getNamedChildCount() > 1) {
            right = node.getNamedChild(1);
        }
        if (operator == null && node.getChildCount() > 1) {
            operator = node.getChild(1);
        }
        return new BinaryExpression(position,
                ParameterNormalizer.valueOr(children, left, new UnknownNode(position)),
                operator != null ? operator.getType() : "",
                ParameterNormalizer.valueOr(children, right, new UnknownNode(position)));
    }

    public static AstNode unary(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        SyntaxNode operator = CursorNavigator.field(cursor, "operator");
        SyntaxNode operand = CursorNavigator.field(cursor, "operand");
        return new UnaryExpression(position,
                operator != null ? operator.getType() : "",
                ParameterNormalizer.valueOr(children, operand, new UnknownNode(position)));
    }

    public static AstNode conditional(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        return new ConditionalExpression(position,
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "condition"), new UnknownNode(position)),
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "consequence"), new UnknownNode(position)),
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "alternative"), new UnknownNode(position)));
    }

    public static AstNode vector(TreeCursor cursor, ChildAdapter children) {
        List<Expression> elements = new ArrayList<>();
        if (cursor.gotoFirstChild()) {
            do {
                if (cursor.isNodeNamed()) {
                    elements.add(children.adaptExpression(cursor.currentNode()));
                }
            } while (cursor.gotoNextSibling());
            cursor.gotoParent();
        }
        return new VectorExpression(PositionExtractor.fromCursor(cursor), elements);
    }

    public static AstNode range(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        return new RangeExpression(position,
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "start"), new UnknownNode(position)),
                ParameterNormalizer.optional(children, CursorNavigator.field(cursor, "step")),
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "end"), new UnknownNode(position)));
    }

    /**
     * 通用调用：用户模块、用户函数以及内建几何关键词出现在表达式位置时
     */
    public static AstNode call(TreeCursor cursor, ChildAdapter children) {
        SyntaxNode node = cursor.currentNode();
        Position position = PositionExtractor.fromCursor(cursor);
        SyntaxNode callee = node.getNamedChildCount() > 0 ? node.getNamedChild(0) : null;
        if (callee == null || !"identifier".equals(callee.getType())) {
            return new UnknownNode(position);
        }

        List<Argument> args = new ArrayList<>();
        for (ArgumentList.Entry entry : ArgumentList.read(cursor).getEntries()) {
            Position argPosition = PositionExtractor.fromNode(entry.getNode());
            Expression value = ParameterNormalizer.valueOr(children, entry.getValue(), new UnknownNode(argPosition));
            args.add(new Argument(argPosition, entry.getName(), value));
        }
        return new CallExpression(position, identifierOf(callee, position), args,
                CursorNavigator.body(cursor, children, "body"));
    }

    // ============ 字符串 ============

    /** 去掉引号并处理转义 */
    static String unquote(String text) {
        String body = text;
        if (body.length() >= 2 && body.charAt(0) == '"' && body.charAt(body.length() - 1) == '"') {
            body = body.substring(1, body.length() - 1);
        }
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '"': sb.append('"'); break;
                case '\\': sb.append('\\'); break;
                default: sb.append('\\').append(next); break;
            }
        }
        return sb.toString();
    }
}
