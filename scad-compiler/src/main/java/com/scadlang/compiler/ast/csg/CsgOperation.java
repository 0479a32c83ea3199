package com.scadlang.compiler.ast.csg;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 布尔运算基类，只携带子节点
 */
public abstract class CsgOperation extends AstNode {
    protected final List<AstNode> children;

    protected CsgOperation(Position position, List<AstNode> children) {
        super(position);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<AstNode> getChildren() {
        return children;
    }
}
