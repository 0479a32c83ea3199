package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * 标识符，特殊变量保留前缀，如 {@code $fn}
 */
public class IdentifierExpression extends Expression {
    private final String name;

    public IdentifierExpression(Position position, String name) {
        super(position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isSpecialVariable() {
        return name.startsWith("$");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifierExpression(this, context);
    }
}
