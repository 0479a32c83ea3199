package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * 条件表达式 {@code cond ? a : b}
 */
public class ConditionalExpression extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public ConditionalExpression(Position position, Expression condition, Expression thenExpr, Expression elseExpr) {
        super(position);
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenExpr() {
        return thenExpr;
    }

    public Expression getElseExpr() {
        return elseExpr;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONDITIONAL_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpression(this, context);
    }
}
