package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 向量字面量 {@code [a, b, c]}
 */
public class VectorExpression extends Expression {
    private final List<Expression> elements;

    public VectorExpression(Position position, List<Expression> elements) {
        super(position);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<Expression> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VECTOR_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVectorExpression(this, context);
    }
}
