package com.scadlang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序根节点
 */
public class Program extends AstNode {
    private final List<AstNode> children;

    public Program(Position position, List<AstNode> children) {
        super(position);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<AstNode> getChildren() {
        return children;
    }

    /** 以新的子节点列表替换，位置保持不变 */
    public Program withChildren(List<AstNode> newChildren) {
        return new Program(position, newChildren);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
