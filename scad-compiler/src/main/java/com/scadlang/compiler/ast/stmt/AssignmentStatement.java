package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.IdentifierExpression;

public class AssignmentStatement extends Statement {
    private final IdentifierExpression left;
    private final Expression right;

    public AssignmentStatement(Position position, IdentifierExpression left, Expression right) {
        super(position);
        this.left = left;
        this.right = right;
    }

    public IdentifierExpression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGNMENT_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignmentStatement(this, context);
    }
}
