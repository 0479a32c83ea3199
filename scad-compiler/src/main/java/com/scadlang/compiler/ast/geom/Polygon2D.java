package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

public class Polygon2D extends Primitive {
    private final Expression points;
    private final Expression paths;
    private final Expression convexity;

    public Polygon2D(Position position, Expression points, Expression paths, Expression convexity) {
        super(position);
        this.points = points;
        this.paths = paths;
        this.convexity = convexity;
    }

    public Expression getPoints() {
        return points;
    }

    public Expression getPaths() {
        return paths;
    }

    public Expression getConvexity() {
        return convexity;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.POLYGON;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPolygon(this, context);
    }
}
