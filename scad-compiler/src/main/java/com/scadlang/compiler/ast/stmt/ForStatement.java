package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * for 语句，多个循环变量时按笛卡尔积迭代
 */
public class ForStatement extends Statement {
    private final List<LoopVariable> variables;
    private final List<AstNode> body;

    public ForStatement(Position position, List<LoopVariable> variables, List<AstNode> body) {
        super(position);
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public List<LoopVariable> getVariables() {
        return variables;
    }

    /** 第一个循环变量，没有时返回 null */
    public LoopVariable getVariable() {
        return variables.isEmpty() ? null : variables.get(0);
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStatement(this, context);
    }
}
