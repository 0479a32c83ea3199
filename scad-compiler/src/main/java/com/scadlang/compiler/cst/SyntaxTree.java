package com.scadlang.compiler.cst;

import java.util.List;

/**
 * 一次解析的结果：根节点、源码与语法错误
 */
public interface SyntaxTree {

    SyntaxNode getRootNode();

    String getSource();

    List<SyntaxError> getErrors();

    default boolean hasErrors() {
        return !getErrors().isEmpty();
    }

    default TreeCursor walk() {
        return getRootNode().walk();
    }
}
