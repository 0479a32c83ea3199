package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 旋转
 *
 * <p>两种形式互斥：{@code rotate(a=[x,y,z])} 填充 angles；{@code rotate(a=deg, v=axis)}
 * 填充 angle，axis 仅在给出 v 时存在。</p>
 */
public class RotateTransform extends Transform {
    private final Expression angle;
    private final Vector3 angles;
    private final Vector3 axis;

    public RotateTransform(Position position, Expression angle, Vector3 angles, Vector3 axis, List<AstNode> children) {
        super(position, children);
        this.angle = angle;
        this.angles = angles;
        this.axis = axis;
    }

    public Expression getAngle() {
        return angle;
    }

    public Vector3 getAngles() {
        return angles;
    }

    public Vector3 getAxis() {
        return axis;
    }

    public boolean isScalarAngle() {
        return angle != null;
    }

    public boolean hasAxis() {
        return axis != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ROTATE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRotate(this, context);
    }
}
