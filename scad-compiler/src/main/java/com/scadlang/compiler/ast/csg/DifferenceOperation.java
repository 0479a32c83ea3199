package com.scadlang.compiler.ast.csg;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.List;

/**
 * 第一个子节点减去其余子节点
 */
public class DifferenceOperation extends CsgOperation {

    public DifferenceOperation(Position position, List<AstNode> children) {
        super(position, children);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DIFFERENCE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDifference(this, context);
    }
}
