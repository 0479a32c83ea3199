package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.csg.*;
import com.scadlang.compiler.ast.expr.*;
import com.scadlang.compiler.ast.geom.*;
import com.scadlang.compiler.ast.stmt.*;
import com.scadlang.compiler.ast.transform.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitUnknown(UnknownNode node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteralExpression(LiteralExpression node, C ctx) { return null; }

    default R visitIdentifierExpression(IdentifierExpression node, C ctx) { return null; }

    default R visitBinaryExpression(BinaryExpression node, C ctx) { return null; }

    default R visitUnaryExpression(UnaryExpression node, C ctx) { return null; }

    default R visitConditionalExpression(ConditionalExpression node, C ctx) { return null; }

    default R visitCallExpression(CallExpression node, C ctx) { return null; }

    default R visitVectorExpression(VectorExpression node, C ctx) { return null; }

    default R visitRangeExpression(RangeExpression node, C ctx) { return null; }

    // ============ 几何体 ============

    default R visitCube(Cube3D node, C ctx) { return null; }

    default R visitSphere(Sphere3D node, C ctx) { return null; }

    default R visitCylinder(Cylinder3D node, C ctx) { return null; }

    default R visitPolyhedron(Polyhedron3D node, C ctx) { return null; }

    default R visitCircle(Circle2D node, C ctx) { return null; }

    default R visitSquare(Square2D node, C ctx) { return null; }

    default R visitPolygon(Polygon2D node, C ctx) { return null; }

    // ============ 变换 ============

    default R visitTranslate(TranslateTransform node, C ctx) { return null; }

    default R visitRotate(RotateTransform node, C ctx) { return null; }

    default R visitScale(ScaleTransform node, C ctx) { return null; }

    default R visitMirror(MirrorTransform node, C ctx) { return null; }

    default R visitColor(ColorTransform node, C ctx) { return null; }

    default R visitLinearExtrude(LinearExtrudeTransform node, C ctx) { return null; }

    default R visitRotateExtrude(RotateExtrudeTransform node, C ctx) { return null; }

    // ============ 布尔运算 ============

    default R visitUnion(UnionOperation node, C ctx) { return null; }

    default R visitDifference(DifferenceOperation node, C ctx) { return null; }

    default R visitIntersection(IntersectionOperation node, C ctx) { return null; }

    default R visitHull(HullOperation node, C ctx) { return null; }

    default R visitMinkowski(MinkowskiOperation node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlockStatement(BlockStatement node, C ctx) { return null; }

    default R visitIfStatement(IfStatement node, C ctx) { return null; }

    default R visitForStatement(ForStatement node, C ctx) { return null; }

    default R visitAssignmentStatement(AssignmentStatement node, C ctx) { return null; }

    default R visitModuleDeclaration(ModuleDeclaration node, C ctx) { return null; }

    default R visitFunctionDeclaration(FunctionDeclaration node, C ctx) { return null; }

    default R visitIncludeStatement(IncludeStatement node, C ctx) { return null; }

    default R visitUseStatement(UseStatement node, C ctx) { return null; }
}
