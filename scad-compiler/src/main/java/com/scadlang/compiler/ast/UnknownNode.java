package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Expression;

/**
 * 无法识别的构造，只携带位置
 */
public class UnknownNode extends Expression {

    public UnknownNode(Position position) {
        super(position);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNKNOWN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnknown(this, context);
    }
}
