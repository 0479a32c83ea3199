package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

public class Circle2D extends Primitive {
    private final Expression radius;
    private final FacetSettings facets;

    public Circle2D(Position position, Expression radius, FacetSettings facets) {
        super(position);
        this.radius = radius;
        this.facets = facets;
    }

    public Expression getRadius() {
        return radius;
    }

    public FacetSettings getFacets() {
        return facets;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CIRCLE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCircle(this, context);
    }
}
