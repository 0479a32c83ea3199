package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * for 循环中的一个 {@code name = iterable}
 */
public final class LoopVariable {
    private final Position position;
    private final String name;
    private final Expression iterable;

    public LoopVariable(Position position, String name, Expression iterable) {
        this.position = position;
        this.name = name;
        this.iterable = iterable;
    }

    public Position getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public Expression getIterable() {
        return iterable;
    }
}
