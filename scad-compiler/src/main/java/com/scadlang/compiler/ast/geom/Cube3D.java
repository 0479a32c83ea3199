package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.LiteralExpression;

/**
 * {@code cube(size, center)}
 */
public class Cube3D extends Primitive {
    private final Vector3 size;
    private final Expression center;

    public Cube3D(Position position, Vector3 size, Expression center) {
        super(position);
        this.size = size;
        this.center = center;
    }

    public Vector3 getSize() {
        return size;
    }

    public Expression getCenter() {
        return center;
    }

    /** center 是字面量 true 时为真 */
    public boolean isCentered() {
        return center instanceof LiteralExpression && ((LiteralExpression) center).isTrue();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CUBE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCube(this, context);
    }
}
