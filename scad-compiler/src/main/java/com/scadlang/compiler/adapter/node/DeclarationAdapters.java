package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.stmt.FunctionDeclaration;
import com.scadlang.compiler.ast.stmt.IncludeStatement;
import com.scadlang.compiler.ast.stmt.ModuleDeclaration;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.ast.stmt.UseStatement;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块 / 函数定义与文件引入
 */
public final class DeclarationAdapters {

    private DeclarationAdapters() {
    }

    public static AstNode moduleDeclaration(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        return new ModuleDeclaration(position,
                nameOf(cursor, position),
                parameters(cursor, children),
                CursorNavigator.body(cursor, children, "body"));
    }

    public static AstNode functionDeclaration(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        return new FunctionDeclaration(position,
                nameOf(cursor, position),
                parameters(cursor, children),
                ParameterNormalizer.valueOr(children, CursorNavigator.field(cursor, "body"), new UnknownNode(position)));
    }

    public static AstNode include(TreeCursor cursor, ChildAdapter children) {
        return new IncludeStatement(PositionExtractor.fromCursor(cursor), path(cursor));
    }

    public static AstNode use(TreeCursor cursor, ChildAdapter children) {
        return new UseStatement(PositionExtractor.fromCursor(cursor), path(cursor));
    }

    private static String nameOf(TreeCursor cursor, Position position) {
        return ExpressionAdapters.identifierOf(CursorNavigator.field(cursor, "name"), position).getName();
    }

    private static List<Parameter> parameters(TreeCursor cursor, ChildAdapter children) {
        List<Parameter> result = new ArrayList<>();
        SyntaxNode list = CursorNavigator.field(cursor, "parameters");
        if (list == null) {
            return result;
        }
        for (SyntaxNode parameter : list.getNamedChildren()) {
            if (!"parameter".equals(parameter.getType())) {
                continue;
            }
            Position position = PositionExtractor.fromNode(parameter);
            SyntaxNode name = parameter.getChildByFieldName("name");
            SyntaxNode defaultValue = parameter.getChildByFieldName("default");
            result.add(new Parameter(position,
                    ExpressionAdapters.identifierOf(name, position).getName(),
                    defaultValue != null && !defaultValue.isMissing() ? children.adaptExpression(defaultValue) : null));
        }
        return result;
    }

    /** 去掉尖括号或引号后的路径，缺失时为空字符串 */
    private static String path(TreeCursor cursor) {
        SyntaxNode path = CursorNavigator.field(cursor, "path");
        if (path == null) {
            return "";
        }
        String text = path.getText();
        if (text.length() >= 2 && text.charAt(0) == '<' && text.charAt(text.length() - 1) == '>') {
            return text.substring(1, text.length() - 1);
        }
        return ExpressionAdapters.unquote(text);
    }
}
