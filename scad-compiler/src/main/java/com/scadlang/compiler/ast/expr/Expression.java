package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(Position position) {
        super(position);
    }
}
