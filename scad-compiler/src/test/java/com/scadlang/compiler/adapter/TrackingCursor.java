package com.scadlang.compiler.adapter;

import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

/**
 * 记录 close 调用次数的游标包装
 */
final class TrackingCursor implements TreeCursor {
    private final TreeCursor delegate;
    private int closeCount;

    TrackingCursor(TreeCursor delegate) {
        this.delegate = delegate;
    }

    int getCloseCount() {
        return closeCount;
    }

    @Override
    public SyntaxNode currentNode() {
        return delegate.currentNode();
    }

    @Override
    public String currentFieldName() {
        return delegate.currentFieldName();
    }

    @Override
    public boolean gotoFirstChild() {
        return delegate.gotoFirstChild();
    }

    @Override
    public boolean gotoNextSibling() {
        return delegate.gotoNextSibling();
    }

    @Override
    public boolean gotoParent() {
        return delegate.gotoParent();
    }

    @Override
    public void reset(SyntaxNode node) {
        delegate.reset(node);
    }

    @Override
    public boolean isClosed() {
        return delegate.isClosed();
    }

    @Override
    public void close() {
        closeCount++;
        delegate.close();
    }
}
