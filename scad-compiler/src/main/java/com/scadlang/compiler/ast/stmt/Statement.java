package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(Position position) {
        super(position);
    }
}
