package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

public class Polyhedron3D extends Primitive {
    private final Expression points;
    private final Expression faces;
    private final Expression convexity;

    public Polyhedron3D(Position position, Expression points, Expression faces, Expression convexity) {
        super(position);
        this.points = points;
        this.faces = faces;
        this.convexity = convexity;
    }

    public Expression getPoints() {
        return points;
    }

    /** faces 或旧写法 triangles */
    public Expression getFaces() {
        return faces;
    }

    public Expression getConvexity() {
        return convexity;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.POLYHEDRON;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPolyhedron(this, context);
    }
}
