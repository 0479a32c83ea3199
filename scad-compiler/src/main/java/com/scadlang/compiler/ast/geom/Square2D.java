package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector2;
import com.scadlang.compiler.ast.expr.Expression;

public class Square2D extends Primitive {
    private final Vector2 size;
    private final Expression center;

    public Square2D(Position position, Vector2 size, Expression center) {
        super(position);
        this.size = size;
        this.center = center;
    }

    public Vector2 getSize() {
        return size;
    }

    public Expression getCenter() {
        return center;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SQUARE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSquare(this, context);
    }
}
