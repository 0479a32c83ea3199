package com.scadlang.compiler.ast.transform;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

public class ColorTransform extends Transform {
    private final Expression color;
    private final Expression alpha;

    public ColorTransform(Position position, Expression color, Expression alpha, List<AstNode> children) {
        super(position, children);
        this.color = color;
        this.alpha = alpha;
    }

    /** 颜色名字符串、十六进制字符串或 RGB(A) 向量 */
    public Expression getColor() {
        return color;
    }

    public Expression getAlpha() {
        return alpha;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COLOR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitColor(this, context);
    }
}
