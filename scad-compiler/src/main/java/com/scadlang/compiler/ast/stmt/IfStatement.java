package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * if 语句
 *
 * <p>分支内容展开为节点列表（块被拆开）。没有 else 时 elseBranch 为 null；
 * {@code else if} 表现为只含一个 IfStatement 的 elseBranch。</p>
 */
public class IfStatement extends Statement {
    private final Expression condition;
    private final List<AstNode> thenBranch;
    private final List<AstNode> elseBranch;

    public IfStatement(Position position, Expression condition, List<AstNode> thenBranch, List<AstNode> elseBranch) {
        super(position);
        this.condition = condition;
        this.thenBranch = Collections.unmodifiableList(new ArrayList<>(thenBranch));
        this.elseBranch = elseBranch != null ? Collections.unmodifiableList(new ArrayList<>(elseBranch)) : null;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<AstNode> getThenBranch() {
        return thenBranch;
    }

    public List<AstNode> getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStatement(this, context);
    }
}
