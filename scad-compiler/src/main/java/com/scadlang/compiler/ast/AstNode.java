package com.scadlang.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final Position position;

    protected AstNode(Position position) {
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }

    public abstract NodeKind getKind();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getKind() + "@" + position;
    }
}
