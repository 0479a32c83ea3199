package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.csg.DifferenceOperation;
import com.scadlang.compiler.ast.csg.HullOperation;
import com.scadlang.compiler.ast.csg.IntersectionOperation;
import com.scadlang.compiler.ast.csg.MinkowskiOperation;
import com.scadlang.compiler.ast.csg.UnionOperation;
import com.scadlang.compiler.cst.TreeCursor;

/**
 * 布尔运算适配，只收集子节点
 */
public final class CsgAdapters {

    private CsgAdapters() {
    }

    public static AstNode union(TreeCursor cursor, ChildAdapter children) {
        return new UnionOperation(PositionExtractor.fromCursor(cursor),
                CursorNavigator.body(cursor, children, "body"));
    }

    public static AstNode difference(TreeCursor cursor, ChildAdapter children) {
        return new DifferenceOperation(PositionExtractor.fromCursor(cursor),
                CursorNavigator.body(cursor, children, "body"));
    }

    public static AstNode intersection(TreeCursor cursor, ChildAdapter children) {
        return new IntersectionOperation(PositionExtractor.fromCursor(cursor),
                CursorNavigator.body(cursor, children, "body"));
    }

    public static AstNode hull(TreeCursor cursor, ChildAdapter children) {
        return new HullOperation(PositionExtractor.fromCursor(cursor),
                CursorNavigator.body(cursor, children, "body"));
    }

    public static AstNode minkowski(TreeCursor cursor, ChildAdapter children) {
        ArgumentList args = ArgumentList.read(cursor);
        return new MinkowskiOperation(PositionExtractor.fromCursor(cursor),
                ParameterNormalizer.optional(children, args.get("convexity", 0)),
                CursorNavigator.body(cursor, children, "body"));
    }
}
