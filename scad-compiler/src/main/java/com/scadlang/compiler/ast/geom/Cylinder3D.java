package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * 圆柱 / 圆台
 *
 * <p>radius2 只在源码给出 r、d、r2 或 d2 时存在；缺省时与 radius1 相同，由求值方解释。</p>
 */
public class Cylinder3D extends Primitive {
    private final Expression height;
    private final Expression radius1;
    private final Expression radius2;
    private final Expression center;
    private final FacetSettings facets;

    public Cylinder3D(Position position, Expression height, Expression radius1, Expression radius2,
                      Expression center, FacetSettings facets) {
        super(position);
        this.height = height;
        this.radius1 = radius1;
        this.radius2 = radius2;
        this.center = center;
        this.facets = facets;
    }

    public Expression getHeight() {
        return height;
    }

    public Expression getRadius1() {
        return radius1;
    }

    public Expression getRadius2() {
        return radius2;
    }

    public boolean hasRadius2() {
        return radius2 != null;
    }

    public Expression getCenter() {
        return center;
    }

    public FacetSettings getFacets() {
        return facets;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CYLINDER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCylinder(this, context);
    }
}
