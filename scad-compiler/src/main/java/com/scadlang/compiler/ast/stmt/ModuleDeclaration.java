package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code module name(params) body}
 */
public class ModuleDeclaration extends Statement {
    private final String name;
    private final List<Parameter> parameters;
    private final List<AstNode> body;

    public ModuleDeclaration(Position position, String name, List<Parameter> parameters, List<AstNode> body) {
        super(position);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE_DECLARATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDeclaration(this, context);
    }
}
