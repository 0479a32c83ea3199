package com.scadlang.compiler.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于帧栈的游标实现
 *
 * <p>每一帧记录节点及其在父节点中的下标，导航不需要节点的父引用。</p>
 */
public final class CstTreeCursor implements TreeCursor {
    private final List<CstNode> nodes = new ArrayList<CstNode>();
    private final List<Integer> indices = new ArrayList<Integer>();
    private boolean closed;

    public CstTreeCursor(CstNode root) {
        push(root, -1);
    }

    @Override
    public CstNode currentNode() {
        ensureOpen();
        return nodes.get(nodes.size() - 1);
    }

    @Override
    public String currentFieldName() {
        ensureOpen();
        int depth = nodes.size();
        if (depth < 2) {
            return null;
        }
        return nodes.get(depth - 2).getFieldNameForChild(indices.get(depth - 1));
    }

    @Override
    public boolean gotoFirstChild() {
        CstNode node = currentNode();
        if (node.getChildCount() == 0) {
            return false;
        }
        push(node.getChild(0), 0);
        return true;
    }

    @Override
    public boolean gotoNextSibling() {
        ensureOpen();
        int depth = nodes.size();
        if (depth < 2) {
            return false;
        }
        CstNode parent = nodes.get(depth - 2);
        int next = indices.get(depth - 1) + 1;
        if (next >= parent.getChildCount()) {
            return false;
        }
        nodes.set(depth - 1, parent.getChild(next));
        indices.set(depth - 1, next);
        return true;
    }

    @Override
    public boolean gotoParent() {
        ensureOpen();
        int depth = nodes.size();
        if (depth < 2) {
            return false;
        }
        nodes.remove(depth - 1);
        indices.remove(depth - 1);
        return true;
    }

    @Override
    public void reset(SyntaxNode node) {
        ensureOpen();
        if (!(node instanceof CstNode)) {
            throw new IllegalArgumentException("cursor cannot be reset to " + node);
        }
        nodes.clear();
        indices.clear();
        push((CstNode) node, -1);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        nodes.clear();
        indices.clear();
    }

    private void push(CstNode node, int index) {
        nodes.add(node);
        indices.add(index);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("tree cursor has been closed");
        }
    }
}
