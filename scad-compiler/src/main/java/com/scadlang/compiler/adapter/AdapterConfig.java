package com.scadlang.compiler.adapter;

/**
 * CST 到 AST 适配配置
 */
public class AdapterConfig {
    private DiameterMode diameterMode = DiameterMode.PASS_THROUGH;
    private boolean strictCallees = false;

    public AdapterConfig() {
    }

    public DiameterMode getDiameterMode() {
        return diameterMode;
    }

    public void setDiameterMode(DiameterMode diameterMode) {
        this.diameterMode = diameterMode != null ? diameterMode : DiameterMode.PASS_THROUGH;
    }

    public boolean isStrictCallees() {
        return strictCallees;
    }

    /**
     * 为 true 时，未识别的调用名归为 Unknown，而不是通用的 CallExpression
     */
    public void setStrictCallees(boolean strictCallees) {
        this.strictCallees = strictCallees;
    }

    /**
     * 直径参数（d、d1、d2）为非字面量表达式时的处理方式。数字字面量总是直接减半。
     */
    public enum DiameterMode {
        /** 原样放入半径字段，不减半 */
        PASS_THROUGH,
        /** 包装为 {@code d / 2} 二元表达式 */
        HALVE_EXPRESSION
    }
}
