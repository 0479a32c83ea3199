package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.cst.Point;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

/**
 * 把 CST 坐标原样复制为 AST 位置
 */
public final class PositionExtractor {

    private PositionExtractor() {
    }

    public static Position fromPoints(Point start, Point end) {
        return new Position(start.getRow(), start.getColumn(), end.getRow(), end.getColumn());
    }

    public static Position fromCursor(TreeCursor cursor) {
        return fromPoints(cursor.getStartPoint(), cursor.getEndPoint());
    }

    public static Position fromNode(SyntaxNode node) {
        return fromPoints(node.getStartPoint(), node.getEndPoint());
    }
}
