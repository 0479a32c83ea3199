package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 变换基类：参数加上按源码顺序排列的子节点
 */
public abstract class Transform extends AstNode {
    protected final List<AstNode> children;

    protected Transform(Position position, List<AstNode> children) {
        super(position);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<AstNode> getChildren() {
        return children;
    }
}
