package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

public class RotateExtrudeTransform extends Transform {
    private final Expression angle;
    private final Expression convexity;
    private final FacetSettings facets;

    public RotateExtrudeTransform(Position position, Expression angle, Expression convexity,
                                  FacetSettings facets, List<AstNode> children) {
        super(position, children);
        this.angle = angle;
        this.convexity = convexity;
        this.facets = facets;
    }

    public Expression getAngle() {
        return angle;
    }

    public Expression getConvexity() {
        return convexity;
    }

    public FacetSettings getFacets() {
        return facets;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ROTATE_EXTRUDE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRotateExtrude(this, context);
    }
}
