package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.AdapterConfig;
import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.ast.FacetSettings;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.Vector2;
import com.scadlang.compiler.ast.Vector3;
import com.scadlang.compiler.ast.expr.BinaryExpression;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.cst.SyntaxNode;

import java.util.List;

/**
 * 参数规范化：默认值、标量广播、直径换算半径、细分精度特殊变量
 *
 * <p>合成的默认值使用整个构造的位置。</p>
 */
public final class ParameterNormalizer {

    private ParameterNormalizer() {
    }

    public static LiteralExpression number(Position position, double value) {
        return LiteralExpression.number(position, value);
    }

    /** node 为 null 时返回 fallback */
    public static Expression valueOr(ChildAdapter children, SyntaxNode node, Expression fallback) {
        return node != null ? children.adaptExpression(node) : fallback;
    }

    /** node 为 null 时返回 null */
    public static Expression optional(ChildAdapter children, SyntaxNode node) {
        return node != null ? children.adaptExpression(node) : null;
    }

    /** 布尔开关，缺省时为给定的布尔字面量 */
    public static Expression flag(ChildAdapter children, SyntaxNode node, boolean defaultValue, Position position) {
        return valueOr(children, node, LiteralExpression.bool(position, defaultValue));
    }

    // ============ 向量 ============

    public static Vector3 vector3(ChildAdapter children, SyntaxNode node, double fill, Position position) {
        if (node == null) {
            return new Vector3(number(position, fill), number(position, fill), number(position, fill));
        }
        return vector3(children.adaptExpression(node), fill);
    }

    /**
     * 向量按分量取值，缺少的分量补 fill，多余的分量丢弃；非向量值广播到所有分量
     */
    public static Vector3 vector3(Expression value, double fill) {
        if (value instanceof VectorExpression) {
            VectorExpression vector = (VectorExpression) value;
            return new Vector3(component(vector, 0, fill), component(vector, 1, fill), component(vector, 2, fill));
        }
        return new Vector3(value, value, value);
    }

    public static Vector2 vector2(ChildAdapter children, SyntaxNode node, double fill, Position position) {
        if (node == null) {
            return new Vector2(number(position, fill), number(position, fill));
        }
        Expression value = children.adaptExpression(node);
        if (value instanceof VectorExpression) {
            VectorExpression vector = (VectorExpression) value;
            return new Vector2(component(vector, 0, fill), component(vector, 1, fill));
        }
        return new Vector2(value, value);
    }

    private static Expression component(VectorExpression vector, int index, double fill) {
        List<Expression> elements = vector.getElements();
        return index < elements.size() ? elements.get(index) : number(vector.getPosition(), fill);
    }

    // ============ 半径 / 直径 ============

    /**
     * 把直径转换为半径
     *
     * <p>数字字面量直接减半；其他表达式按 {@link AdapterConfig.DiameterMode} 处理。</p>
     */
    public static Expression halve(ChildAdapter children, SyntaxNode diameter) {
        Expression value = children.adaptExpression(diameter);
        if (value instanceof LiteralExpression && ((LiteralExpression) value).isNumber()) {
            return number(value.getPosition(), ((LiteralExpression) value).getNumber() / 2);
        }
        if (children.config().getDiameterMode() == AdapterConfig.DiameterMode.HALVE_EXPRESSION) {
            return new BinaryExpression(value.getPosition(), value, "/", number(value.getPosition(), 2));
        }
        return value;
    }

    /**
     * 半径参数，直径形式优先；两者都没有时返回 null
     */
    public static Expression radiusOrNull(ChildAdapter children, ArgumentList args,
                                          String radiusName, int radiusPosition, String diameterName) {
        SyntaxNode diameter = args.named(diameterName);
        if (diameter != null) {
            return halve(children, diameter);
        }
        return optional(children, args.get(radiusName, radiusPosition));
    }

    // ============ 特殊变量 ============

    /** 只接受命名形式，未出现的保持为 null */
    public static FacetSettings facets(ChildAdapter children, ArgumentList args) {
        Expression fn = optional(children, args.named("$fn"));
        Expression fa = optional(children, args.named("$fa"));
        Expression fs = optional(children, args.named("$fs"));
        if (fn == null && fa == null && fs == null) {
            return FacetSettings.NONE;
        }
        return new FacetSettings(fn, fa, fs);
    }
}
