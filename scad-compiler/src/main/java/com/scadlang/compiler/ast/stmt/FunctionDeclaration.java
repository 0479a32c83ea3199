package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code function name(params) = expr;}
 */
public class FunctionDeclaration extends Statement {
    private final String name;
    private final List<Parameter> parameters;
    private final Expression body;

    public FunctionDeclaration(Position position, String name, List<Parameter> parameters, Expression body) {
        super(position);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_DECLARATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDeclaration(this, context);
    }
}
