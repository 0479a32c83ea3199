package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.Position;

/**
 * 调用实参：位置参数的 name 为 null
 */
public final class Argument {
    private final Position position;
    private final String name;
    private final Expression value;

    public Argument(Position position, String name, Expression value) {
        this.position = position;
        this.name = name;
        this.value = value;
    }

    public Position getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isNamed() {
        return name != null;
    }
}
