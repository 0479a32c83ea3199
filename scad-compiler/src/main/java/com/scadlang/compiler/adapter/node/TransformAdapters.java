package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector3;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.ast.transform.ColorTransform;
import com.scadlang.compiler.ast.transform.LinearExtrudeTransform;
import com.scadlang.compiler.ast.transform.MirrorTransform;
import com.scadlang.compiler.ast.transform.RotateExtrudeTransform;
import com.scadlang.compiler.ast.transform.RotateTransform;
import com.scadlang.compiler.ast.transform.ScaleTransform;
import com.scadlang.compiler.ast.transform.TranslateTransform;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.List;

import static com.scadlang.compiler.adapter.node.ParameterNormalizer.*;

/**
 * 变换适配：参数之外，body 中的语句按源码顺序成为子节点
 */
public final class TransformAdapters {

    private TransformAdapters() {
    }

    /** {@code translate(v)}，缺少的分量为 0 */
    public static AstNode translate(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new TranslateTransform(position,
                vector3(children, args.get("v", 0), 0, position),
                body(cursor, children));
    }

    /**
     * {@code rotate(a = [x, y, z])} 或 {@code rotate(a = deg, v = axis)}
     */
    public static AstNode rotate(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        Expression a = valueOr(children, args.get("a", 0), number(position, 0));
        SyntaxNode v = args.get("v", 1);
        Vector3 axis = v != null ? vector3(children.adaptExpression(v), 0) : null;
        if (a instanceof VectorExpression) {
            return new RotateTransform(position, null, vector3(a, 0), axis, body(cursor, children));
        }
        return new RotateTransform(position, a, null, axis, body(cursor, children));
    }

    /** {@code scale(v)}，标量广播，缺少的分量为 1 */
    public static AstNode scale(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new ScaleTransform(position,
                vector3(children, args.get("v", 0), 1, position),
                body(cursor, children));
    }

    /** {@code mirror(v = [1, 0, 0])} */
    public static AstNode mirror(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        SyntaxNode v = args.get("v", 0);
        Vector3 normal = v != null
                ? vector3(children.adaptExpression(v), 0)
                : new Vector3(number(position, 1), number(position, 0), number(position, 0));
        return new MirrorTransform(position, normal, body(cursor, children));
    }

    /** {@code color(c, alpha)}，缺少颜色时为 undef */
    public static AstNode color(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new ColorTransform(position,
                valueOr(children, args.get("c", 0), LiteralExpression.undef(position)),
                optional(children, args.get("alpha", 1)),
                body(cursor, children));
    }

    /** {@code linear_extrude(height = 1, center = false, convexity, twist, slices, scale)} */
    public static AstNode linearExtrude(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new LinearExtrudeTransform(position,
                valueOr(children, args.get("height", 0), number(position, 1)),
                flag(children, args.get("center", 1), false, position),
                optional(children, args.get("convexity", 2)),
                optional(children, args.get("twist", 3)),
                optional(children, args.get("slices", 4)),
                optional(children, args.get("scale", 5)),
                facets(children, args),
                body(cursor, children));
    }

    /** {@code rotate_extrude(angle = 360, convexity)} */
    public static AstNode rotateExtrude(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new RotateExtrudeTransform(position,
                valueOr(children, args.get("angle", 0), number(position, 360)),
                optional(children, args.get("convexity", 1)),
                facets(children, args),
                body(cursor, children));
    }

    private static List<AstNode> body(TreeCursor cursor, ChildAdapter children) {
        return CursorNavigator.body(cursor, children, "body");
    }
}
