package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用或用户模块实例化
 *
 * <p>作为语句出现时，children 保存实例化的子几何体；作为表达式时为空。</p>
 */
public class CallExpression extends Expression {
    private final IdentifierExpression callee;
    private final List<Argument> args;
    private final List<AstNode> children;

    public CallExpression(Position position, IdentifierExpression callee, List<Argument> args, List<AstNode> children) {
        super(position);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public IdentifierExpression getCallee() {
        return callee;
    }

    public String getCalleeName() {
        return callee.getName();
    }

    public List<Argument> getArgs() {
        return args;
    }

    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpression(this, context);
    }
}
