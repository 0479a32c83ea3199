package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

/**
 * {@code use <path>}，path 不含尖括号或引号
 */
public class UseStatement extends Statement {
    private final String path;

    public UseStatement(Position position, String path) {
        super(position);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USE_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUseStatement(this, context);
    }
}
