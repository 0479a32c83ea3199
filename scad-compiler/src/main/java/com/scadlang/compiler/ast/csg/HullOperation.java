package com.scadlang.compiler.ast.csg;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.List;

/**
 * 子节点的凸包
 */
public class HullOperation extends CsgOperation {

    public HullOperation(Position position, List<AstNode> children) {
        super(position, children);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.HULL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitHull(this, context);
    }
}
