package com.scadlang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.Vector2;
import com.scadlang.compiler.ast.Vector3;
import com.scadlang.compiler.ast.csg.CsgOperation;
import com.scadlang.compiler.ast.csg.DifferenceOperation;
import com.scadlang.compiler.ast.csg.HullOperation;
import com.scadlang.compiler.ast.csg.IntersectionOperation;
import com.scadlang.compiler.ast.csg.MinkowskiOperation;
import com.scadlang.compiler.ast.csg.UnionOperation;
import com.scadlang.compiler.ast.expr.Argument;
import com.scadlang.compiler.ast.expr.BinaryExpression;
import com.scadlang.compiler.ast.expr.CallExpression;
import com.scadlang.compiler.ast.expr.ConditionalExpression;
import com.scadlang.compiler.ast.expr.IdentifierExpression;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.expr.RangeExpression;
import com.scadlang.compiler.ast.expr.UnaryExpression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.ast.geom.Circle2D;
import com.scadlang.compiler.ast.geom.Cube3D;
import com.scadlang.compiler.ast.geom.Cylinder3D;
import com.scadlang.compiler.ast.geom.Polygon2D;
import com.scadlang.compiler.ast.geom.Polyhedron3D;
import com.scadlang.compiler.ast.geom.Sphere3D;
import com.scadlang.compiler.ast.geom.Square2D;
import com.scadlang.compiler.ast.stmt.AssignmentStatement;
import com.scadlang.compiler.ast.stmt.BlockStatement;
import com.scadlang.compiler.ast.stmt.ForStatement;
import com.scadlang.compiler.ast.stmt.FunctionDeclaration;
import com.scadlang.compiler.ast.stmt.IfStatement;
import com.scadlang.compiler.ast.stmt.IncludeStatement;
import com.scadlang.compiler.ast.stmt.LoopVariable;
import com.scadlang.compiler.ast.stmt.ModuleDeclaration;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.ast.stmt.UseStatement;
import com.scadlang.compiler.ast.transform.ColorTransform;
import com.scadlang.compiler.ast.transform.LinearExtrudeTransform;
import com.scadlang.compiler.ast.transform.MirrorTransform;
import com.scadlang.compiler.ast.transform.RotateExtrudeTransform;
import com.scadlang.compiler.ast.transform.RotateTransform;
import com.scadlang.compiler.ast.transform.ScaleTransform;
import com.scadlang.compiler.ast.transform.Transform;
import com.scadlang.compiler.ast.transform.TranslateTransform;

import java.util.List;

/**
 * 把 AST 投影为 JSON
 *
 * <p>每个节点输出 {@code type}（规范名）与 {@code position}（LSP Range 形式），
 * 其余字段按节点种类输出。缺省的可选字段不输出。</p>
 */
public class AstJsonSerializer implements AstVisitor<JsonObject, Void> {

    public JsonElement toJson(AstNode node) {
        if (node == null) {
            return JsonNull.INSTANCE;
        }
        return node.accept(this, null);
    }

    // ============ 辅助 ============

    private JsonObject base(AstNode node) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", node.getKind().getCanonicalName());
        obj.add("position", position(node.getPosition()));
        return obj;
    }

    static JsonObject position(Position p) {
        return SyntaxDiagnostics.createRange(p.getStartLine(), p.getStartColumn(), p.getEndLine(), p.getEndColumn());
    }

    private JsonArray nodes(List<? extends AstNode> list) {
        JsonArray array = new JsonArray();
        for (AstNode node : list) {
            array.add(toJson(node));
        }
        return array;
    }

    private void put(JsonObject obj, String name, AstNode value) {
        if (value != null) {
            obj.add(name, toJson(value));
        }
    }

    private JsonObject vector3(Vector3 v) {
        JsonObject obj = new JsonObject();
        obj.add("x", toJson(v.getX()));
        obj.add("y", toJson(v.getY()));
        obj.add("z", toJson(v.getZ()));
        return obj;
    }

    private JsonObject vector2(Vector2 v) {
        JsonObject obj = new JsonObject();
        obj.add("x", toJson(v.getX()));
        obj.add("y", toJson(v.getY()));
        return obj;
    }

    private void putFacets(JsonObject obj, FacetSettings facets) {
        if (facets == null || facets.isEmpty()) {
            return;
        }
        JsonObject f = new JsonObject();
        put(f, "$fn", facets.getFn());
        put(f, "$fa", facets.getFa());
        put(f, "$fs", facets.getFs());
        obj.add("facets", f);
    }

    private JsonObject withChildren(AstNode node, List<AstNode> children) {
        JsonObject obj = base(node);
        obj.add("children", nodes(children));
        return obj;
    }

    private JsonObject transform(Transform node) {
        return withChildren(node, node.getChildren());
    }

    private JsonObject csg(CsgOperation node) {
        return withChildren(node, node.getChildren());
    }

    private JsonArray parameters(List<Parameter> parameters) {
        JsonArray array = new JsonArray();
        for (Parameter p : parameters) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", p.getName());
            obj.add("position", position(p.getPosition()));
            put(obj, "defaultValue", p.getDefaultValue());
            array.add(obj);
        }
        return array;
    }

    // ============ 根与未知 ============

    @Override
    public JsonObject visitProgram(Program node, Void ctx) {
        return withChildren(node, node.getChildren());
    }

    @Override
    public JsonObject visitUnknown(UnknownNode node, Void ctx) {
        return base(node);
    }

    // ============ 表达式 ============

    @Override
    public JsonObject visitLiteralExpression(LiteralExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("valueType", node.getValueType().name().toLowerCase());
        switch (node.getValueType()) {
            case NUMBER:
                double number = node.getNumber();
                if (Double.isNaN(number) || Double.isInfinite(number)) {
                    // JSON 没有 Infinity/NaN，以字符串输出
                    obj.addProperty("value", String.valueOf(number));
                } else {
                    obj.addProperty("value", number);
                }
                break;
            case STRING:
                obj.addProperty("value", (String) node.getValue());
                break;
            case BOOLEAN:
                obj.addProperty("value", node.isTrue());
                break;
            default:
                obj.add("value", JsonNull.INSTANCE);
                break;
        }
        return obj;
    }

    @Override
    public JsonObject visitIdentifierExpression(IdentifierExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("name", node.getName());
        return obj;
    }

    @Override
    public JsonObject visitBinaryExpression(BinaryExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("operator", node.getOperator());
        put(obj, "left", node.getLeft());
        put(obj, "right", node.getRight());
        return obj;
    }

    @Override
    public JsonObject visitUnaryExpression(UnaryExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("operator", node.getOperator());
        put(obj, "operand", node.getOperand());
        return obj;
    }

    @Override
    public JsonObject visitConditionalExpression(ConditionalExpression node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "condition", node.getCondition());
        put(obj, "thenExpr", node.getThenExpr());
        put(obj, "elseExpr", node.getElseExpr());
        return obj;
    }

    @Override
    public JsonObject visitCallExpression(CallExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("callee", node.getCalleeName());
        JsonArray args = new JsonArray();
        for (Argument arg : node.getArgs()) {
            JsonObject a = new JsonObject();
            if (arg.isNamed()) {
                a.addProperty("name", arg.getName());
            }
            a.add("value", toJson(arg.getValue()));
            args.add(a);
        }
        obj.add("args", args);
        obj.add("children", nodes(node.getChildren()));
        return obj;
    }

    @Override
    public JsonObject visitVectorExpression(VectorExpression node, Void ctx) {
        JsonObject obj = base(node);
        obj.add("elements", nodes(node.getElements()));
        return obj;
    }

    @Override
    public JsonObject visitRangeExpression(RangeExpression node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "start", node.getStart());
        put(obj, "step", node.getStep());
        put(obj, "end", node.getEnd());
        return obj;
    }

    // ============ 几何体 ============

    @Override
    public JsonObject visitCube(Cube3D node, Void ctx) {
        JsonObject obj = base(node);
        obj.add("size", vector3(node.getSize()));
        put(obj, "center", node.getCenter());
        return obj;
    }

    @Override
    public JsonObject visitSphere(Sphere3D node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "radius", node.getRadius());
        putFacets(obj, node.getFacets());
        return obj;
    }

    @Override
    public JsonObject visitCylinder(Cylinder3D node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "height", node.getHeight());
        put(obj, "radius1", node.getRadius1());
        put(obj, "radius2", node.getRadius2());
        put(obj, "center", node.getCenter());
        putFacets(obj, node.getFacets());
        return obj;
    }

    @Override
    public JsonObject visitPolyhedron(Polyhedron3D node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "points", node.getPoints());
        put(obj, "faces", node.getFaces());
        put(obj, "convexity", node.getConvexity());
        return obj;
    }

    @Override
    public JsonObject visitCircle(Circle2D node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "radius", node.getRadius());
        putFacets(obj, node.getFacets());
        return obj;
    }

    @Override
    public JsonObject visitSquare(Square2D node, Void ctx) {
        JsonObject obj = base(node);
        obj.add("size", vector2(node.getSize()));
        put(obj, "center", node.getCenter());
        return obj;
    }

    @Override
    public JsonObject visitPolygon(Polygon2D node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "points", node.getPoints());
        put(obj, "paths", node.getPaths());
        put(obj, "convexity", node.getConvexity());
        return obj;
    }

    // ============ 变换 ============

    @Override
    public JsonObject visitTranslate(TranslateTransform node, Void ctx) {
        JsonObject obj = transform(node);
        obj.add("vector", vector3(node.getVector()));
        return obj;
    }

    @Override
    public JsonObject visitRotate(RotateTransform node, Void ctx) {
        JsonObject obj = transform(node);
        if (node.isScalarAngle()) {
            put(obj, "angle", node.getAngle());
        } else if (node.getAngles() != null) {
            obj.add("angles", vector3(node.getAngles()));
        }
        if (node.hasAxis()) {
            obj.add("axis", vector3(node.getAxis()));
        }
        return obj;
    }

    @Override
    public JsonObject visitScale(ScaleTransform node, Void ctx) {
        JsonObject obj = transform(node);
        obj.add("factors", vector3(node.getFactors()));
        return obj;
    }

    @Override
    public JsonObject visitMirror(MirrorTransform node, Void ctx) {
        JsonObject obj = transform(node);
        obj.add("normal", vector3(node.getNormal()));
        return obj;
    }

    @Override
    public JsonObject visitColor(ColorTransform node, Void ctx) {
        JsonObject obj = transform(node);
        put(obj, "color", node.getColor());
        put(obj, "alpha", node.getAlpha());
        return obj;
    }

    @Override
    public JsonObject visitLinearExtrude(LinearExtrudeTransform node, Void ctx) {
        JsonObject obj = transform(node);
        put(obj, "height", node.getHeight());
        put(obj, "center", node.getCenter());
        put(obj, "convexity", node.getConvexity());
        put(obj, "twist", node.getTwist());
        put(obj, "slices", node.getSlices());
        put(obj, "scale", node.getScale());
        putFacets(obj, node.getFacets());
        return obj;
    }

    @Override
    public JsonObject visitRotateExtrude(RotateExtrudeTransform node, Void ctx) {
        JsonObject obj = transform(node);
        put(obj, "angle", node.getAngle());
        put(obj, "convexity", node.getConvexity());
        putFacets(obj, node.getFacets());
        return obj;
    }

    // ============ 布尔运算 ============

    @Override
    public JsonObject visitUnion(UnionOperation node, Void ctx) {
        return csg(node);
    }

    @Override
    public JsonObject visitDifference(DifferenceOperation node, Void ctx) {
        return csg(node);
    }

    @Override
    public JsonObject visitIntersection(IntersectionOperation node, Void ctx) {
        return csg(node);
    }

    @Override
    public JsonObject visitHull(HullOperation node, Void ctx) {
        return csg(node);
    }

    @Override
    public JsonObject visitMinkowski(MinkowskiOperation node, Void ctx) {
        JsonObject obj = csg(node);
        put(obj, "convexity", node.getConvexity());
        return obj;
    }

    // ============ 语句 ============

    @Override
    public JsonObject visitBlockStatement(BlockStatement node, Void ctx) {
        JsonObject obj = base(node);
        obj.add("statements", nodes(node.getStatements()));
        return obj;
    }

    @Override
    public JsonObject visitIfStatement(IfStatement node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "condition", node.getCondition());
        obj.add("thenBranch", nodes(node.getThenBranch()));
        if (node.hasElse()) {
            obj.add("elseBranch", nodes(node.getElseBranch()));
        }
        return obj;
    }

    @Override
    public JsonObject visitForStatement(ForStatement node, Void ctx) {
        JsonObject obj = base(node);
        JsonArray variables = new JsonArray();
        for (LoopVariable v : node.getVariables()) {
            JsonObject var = new JsonObject();
            var.addProperty("name", v.getName());
            var.add("position", position(v.getPosition()));
            put(var, "iterable", v.getIterable());
            variables.add(var);
        }
        obj.add("variables", variables);
        obj.add("body", nodes(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitAssignmentStatement(AssignmentStatement node, Void ctx) {
        JsonObject obj = base(node);
        put(obj, "left", node.getLeft());
        put(obj, "right", node.getRight());
        return obj;
    }

    @Override
    public JsonObject visitModuleDeclaration(ModuleDeclaration node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("name", node.getName());
        obj.add("parameters", parameters(node.getParameters()));
        obj.add("body", nodes(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitFunctionDeclaration(FunctionDeclaration node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("name", node.getName());
        obj.add("parameters", parameters(node.getParameters()));
        put(obj, "body", node.getBody());
        return obj;
    }

    @Override
    public JsonObject visitIncludeStatement(IncludeStatement node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("path", node.getPath());
        return obj;
    }

    @Override
    public JsonObject visitUseStatement(UseStatement node, Void ctx) {
        JsonObject obj = base(node);
        obj.addProperty("path", node.getPath());
        return obj;
    }
}
