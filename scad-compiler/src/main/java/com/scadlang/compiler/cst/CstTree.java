package com.scadlang.compiler.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link SyntaxTree} 的内存实现
 */
public final class CstTree implements SyntaxTree {
    private final CstNode root;
    private final String source;
    private final List<SyntaxError> errors;

    public CstTree(CstNode root, String source, List<SyntaxError> errors) {
        this.root = root;
        this.source = source;
        this.errors = Collections.unmodifiableList(new ArrayList<SyntaxError>(errors));
    }

    @Override
    public CstNode getRootNode() {
        return root;
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public List<SyntaxError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
