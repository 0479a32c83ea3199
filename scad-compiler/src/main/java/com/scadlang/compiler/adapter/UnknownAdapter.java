package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.logging.Logger;

/**
 * 兜底适配：只保留位置
 */
public final class UnknownAdapter implements NodeAdapter {
    private static final Logger LOG = Logger.getLogger(UnknownAdapter.class.getName());

    public static final UnknownAdapter INSTANCE = new UnknownAdapter();

    private UnknownAdapter() {
    }

    @Override
    public AstNode adapt(TreeCursor cursor, ChildAdapter children) {
        LOG.fine("未识别的构造: " + cursor.getNodeType() + " @ " + cursor.getStartPoint());
        return new UnknownNode(PositionExtractor.fromCursor(cursor));
    }
}
