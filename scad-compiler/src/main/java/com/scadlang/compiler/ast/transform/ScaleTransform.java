package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;

import java.util.List;

public class ScaleTransform extends Transform {
    private final Vector3 factors;

    public ScaleTransform(Position position, Vector3 factors, List<AstNode> children) {
        super(position, children);
        this.factors = factors;
    }

    public Vector3 getFactors() {
        return factors;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SCALE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitScale(this, context);
    }
}
