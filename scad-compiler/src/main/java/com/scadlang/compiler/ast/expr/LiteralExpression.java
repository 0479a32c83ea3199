package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * 字面量表达式
 */
public class LiteralExpression extends Expression {
    private final ValueType valueType;
    private final Object value;

    public LiteralExpression(Position position, ValueType valueType, Object value) {
        super(position);
        this.valueType = valueType;
        this.value = value;
    }

    public static LiteralExpression number(Position position, double value) {
        return new LiteralExpression(position, ValueType.NUMBER, value);
    }

    public static LiteralExpression string(Position position, String value) {
        return new LiteralExpression(position, ValueType.STRING, value);
    }

    public static LiteralExpression bool(Position position, boolean value) {
        return new LiteralExpression(position, ValueType.BOOLEAN, value);
    }

    public static LiteralExpression undef(Position position) {
        return new LiteralExpression(position, ValueType.UNDEF, null);
    }

    public ValueType getValueType() {
        return valueType;
    }

    /** NUMBER 为 Double，STRING 为 String，BOOLEAN 为 Boolean，UNDEF 为 null */
    public Object getValue() {
        return value;
    }

    public boolean isNumber() {
        return valueType == ValueType.NUMBER;
    }

    public double getNumber() {
        if (valueType != ValueType.NUMBER) {
            throw new IllegalStateException("not a number literal: " + valueType);
        }
        return (Double) value;
    }

    public boolean isTrue() {
        return valueType == ValueType.BOOLEAN && (Boolean) value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralExpression(this, context);
    }

    /**
     * 字面量值类型
     */
    public enum ValueType {
        NUMBER,
        STRING,
        BOOLEAN,
        UNDEF
    }
}
