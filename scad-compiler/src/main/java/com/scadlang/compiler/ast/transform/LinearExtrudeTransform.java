package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 线性拉伸
 *
 * <p>height 与 center 总是存在；convexity、twist、slices、scale 未给出时为 null。</p>
 */
public class LinearExtrudeTransform extends Transform {
    private final Expression height;
    private final Expression center;
    private final Expression convexity;
    private final Expression twist;
    private final Expression slices;
    private final Expression scale;
    private final FacetSettings facets;

    public LinearExtrudeTransform(Position position, Expression height, Expression center,
                                  Expression convexity, Expression twist, Expression slices, Expression scale,
                                  FacetSettings facets, List<AstNode> children) {
        super(position, children);
        this.height = height;
        this.center = center;
        this.convexity = convexity;
        this.twist = twist;
        this.slices = slices;
        this.scale = scale;
        this.facets = facets;
    }

    public Expression getHeight() {
        return height;
    }

    public Expression getCenter() {
        return center;
    }

    public Expression getConvexity() {
        return convexity;
    }

    public Expression getTwist() {
        return twist;
    }

    public Expression getSlices() {
        return slices;
    }

    public Expression getScale() {
        return scale;
    }

    public FacetSettings getFacets() {
        return facets;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LINEAR_EXTRUDE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLinearExtrude(this, context);
    }
}
