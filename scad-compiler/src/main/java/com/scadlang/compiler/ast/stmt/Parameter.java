package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * 模块 / 函数形参，defaultValue 可为 null
 */
public final class Parameter {
    private final Position position;
    private final String name;
    private final Expression defaultValue;

    public Parameter(Position position, String name, Expression defaultValue) {
        this.position = position;
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public Position getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
