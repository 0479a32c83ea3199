package com.scadlang.compiler.ast.geom;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;

/**
 * 几何体基类，几何体没有子节点
 */
public abstract class Primitive extends AstNode {

    protected Primitive(Position position) {
        super(position);
    }
}
