package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;

import java.util.List;

/**
 * 关于过原点、法向为 normal 的平面镜像
 */
public class MirrorTransform extends Transform {
    private final Vector3 normal;

    public MirrorTransform(Position position, Vector3 normal, List<AstNode> children) {
        super(position, children);
        this.normal = normal;
    }

    public Vector3 getNormal() {
        return normal;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MIRROR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMirror(this, context);
    }
}
