package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Expression;

/**
 * 三分量参数，每个分量是独立的表达式
 */
public final class Vector3 {
    private final Expression x;
    private final Expression y;
    private final Expression z;

    public Vector3(Expression x, Expression y, Expression z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public Expression getX() {
        return x;
    }

    public Expression getY() {
        return y;
    }

    public Expression getZ() {
        return z;
    }
}
