package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * 范围 {@code [start : step : end]}，省略步长时 step 为 null
 */
public class RangeExpression extends Expression {
    private final Expression start;
    private final Expression step;
    private final Expression end;

    public RangeExpression(Position position, Expression start, Expression step, Expression end) {
        super(position);
        this.start = start;
        this.step = step;
        this.end = end;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getStep() {
        return step;
    }

    public boolean hasStep() {
        return step != null;
    }

    public Expression getEnd() {
        return end;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpression(this, context);
    }
}
