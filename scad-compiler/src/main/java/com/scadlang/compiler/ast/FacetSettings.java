package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Expression;

/**
 * 细分精度特殊变量 {@code $fn / $fa / $fs}
 *
 * <p>未出现的值保持 null，不做默认填充，调用方据此区分"未指定"与"指定为某值"。</p>
 */
public final class FacetSettings {
    public static final FacetSettings NONE = new FacetSettings(null, null, null);

    private final Expression fn;
    private final Expression fa;
    private final Expression fs;

    public FacetSettings(Expression fn, Expression fa, Expression fs) {
        this.fn = fn;
        this.fa = fa;
        this.fs = fs;
    }

    public Expression getFn() {
        return fn;
    }

    public Expression getFa() {
        return fa;
    }

    public Expression getFs() {
        return fs;
    }

    public boolean hasFn() {
        return fn != null;
    }

    public boolean hasFa() {
        return fa != null;
    }

    public boolean hasFs() {
        return fs != null;
    }

    public boolean isEmpty() {
        return fn == null && fa == null && fs == null;
    }
}
