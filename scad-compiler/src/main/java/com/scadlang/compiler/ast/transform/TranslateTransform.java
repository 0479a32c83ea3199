package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;

import java.util.List;

public class TranslateTransform extends Transform {
    private final Vector3 vector;

    public TranslateTransform(Position position, Vector3 vector, List<AstNode> children) {
        super(position, children);
        this.vector = vector;
    }

    public Vector3 getVector() {
        return vector;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRANSLATE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTranslate(this, context);
    }
}
