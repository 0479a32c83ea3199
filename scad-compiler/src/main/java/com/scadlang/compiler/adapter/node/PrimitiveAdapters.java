package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.adapter.PositionExtractor;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.ast.geom.Circle2D;
import com.scadlang.compiler.ast.geom.Cube3D;
import com.scadlang.compiler.ast.geom.Cylinder3D;
import com.scadlang.compiler.ast.geom.Polygon2D;
import com.scadlang.compiler.ast.geom.Polyhedron3D;
import com.scadlang.compiler.ast.geom.Sphere3D;
import com.scadlang.compiler.ast.geom.Square2D;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.Collections;

import static com.scadlang.compiler.adapter.node.ParameterNormalizer.*;

/**
 * 几何体适配，位置参数顺序与 OpenSCAD 内建签名一致
 */
public final class PrimitiveAdapters {

    private PrimitiveAdapters() {
    }

    /** {@code cube(size = 1, center = false)} */
    public static AstNode cube(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new Cube3D(position,
                vector3(children, args.get("size", 0), 1, position),
                flag(children, args.get("center", 1), false, position));
    }

    /** {@code sphere(r = 1)} 或 {@code sphere(d = ...)} */
    public static AstNode sphere(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        Expression radius = radiusOrNull(children, args, "r", 0, "d");
        return new Sphere3D(position,
                radius != null ? radius : number(position, 1),
                facets(children, args));
    }

    /**
     * {@code cylinder(h = 1, r1, r2, center = false)}，另有 r、d、d1、d2
     *
     * <p>专用参数（r1/d1、r2/d2）优先于通用参数（r/d），同一层级直径优先于半径。</p>
     */
    public static AstNode cylinder(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);

        Expression general = radiusOrNull(children, args, "r", -1, "d");
        Expression radius1 = radiusOrNull(children, args, "r1", 1, "d1");
        Expression radius2 = radiusOrNull(children, args, "r2", 2, "d2");
        if (radius1 == null) {
            radius1 = general != null ? general : number(position, 1);
        }
        if (radius2 == null) {
            radius2 = general;
        }

        return new Cylinder3D(position,
                valueOr(children, args.get("h", 0), number(position, 1)),
                radius1,
                radius2,
                flag(children, args.get("center", 3), false, position),
                facets(children, args));
    }

    /** {@code polyhedron(points, faces, convexity)}，兼容旧参数名 triangles */
    public static AstNode polyhedron(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        SyntaxNode faces = args.get("faces", 1);
        if (faces == null) {
            faces = args.named("triangles");
        }
        return new Polyhedron3D(position,
                valueOr(children, args.get("points", 0), emptyVector(position)),
                valueOr(children, faces, emptyVector(position)),
                optional(children, args.get("convexity", 2)));
    }

    public static AstNode circle(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        Expression radius = radiusOrNull(children, args, "r", 0, "d");
        return new Circle2D(position,
                radius != null ? radius : number(position, 1),
                facets(children, args));
    }

    /** {@code square(size = 1, center = false)} */
    public static AstNode square(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new Square2D(position,
                vector2(children, args.get("size", 0), 1, position),
                flag(children, args.get("center", 1), false, position));
    }

    /** {@code polygon(points = [], paths, convexity)} */
    public static AstNode polygon(TreeCursor cursor, ChildAdapter children) {
        Position position = PositionExtractor.fromCursor(cursor);
        ArgumentList args = ArgumentList.read(cursor);
        return new Polygon2D(position,
                valueOr(children, args.get("points", 0), emptyVector(position)),
                optional(children, args.get("paths", 1)),
                optional(children, args.get("convexity", 2)));
    }

    private static VectorExpression emptyVector(Position position) {
        return new VectorExpression(position, Collections.<Expression>emptyList());
    }
}
