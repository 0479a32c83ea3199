package com.scadlang.compiler.ast.csg;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.List;

public class IntersectionOperation extends CsgOperation {

    public IntersectionOperation(Position position, List<AstNode> children) {
        super(position, children);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTERSECTION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntersection(this, context);
    }
}
