package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * 一元表达式（{@code ! - +}）
 */
public class UnaryExpression extends Expression {
    private final String operator;
    private final Expression operand;

    public UnaryExpression(Position position, String operator, Expression operand) {
        super(position);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpression(this, context);
    }
}
