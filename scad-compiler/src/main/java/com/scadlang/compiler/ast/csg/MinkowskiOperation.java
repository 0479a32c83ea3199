package com.scadlang.compiler.ast.csg;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 闵可夫斯基和，convexity 可选
 */
public class MinkowskiOperation extends CsgOperation {
    private final Expression convexity;

    public MinkowskiOperation(Position position, Expression convexity, List<AstNode> children) {
        super(position, children);
        this.convexity = convexity;
    }

    public Expression getConvexity() {
        return convexity;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MINKOWSKI;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMinkowski(this, context);
    }
}
