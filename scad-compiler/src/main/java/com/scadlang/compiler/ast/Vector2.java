package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Expression;

/**
 * 二分量参数
 */
public final class Vector2 {
    private final Expression x;
    private final Expression y;

    public Vector2(Expression x, Expression y) {
        this.x = x;
        this.y = y;
    }

    public Expression getX() {
        return x;
    }

    public Expression getY() {
        return y;
    }
}
