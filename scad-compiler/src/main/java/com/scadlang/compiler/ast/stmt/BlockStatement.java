package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BlockStatement extends Statement {
    private final List<AstNode> statements;

    public BlockStatement(Position position, List<AstNode> statements) {
        super(position);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<AstNode> getStatements() {
        return statements;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockStatement(this, context);
    }
}
