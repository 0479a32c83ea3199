package com.scadlang.compiler.cst;

/**
 * 把源码解析为具体语法树的外部协作者
 *
 * <p>对畸形输入也必须返回一棵树（包含 ERROR / missing 节点），而不是抛出异常。</p>
 */
public interface SyntaxParser {

    SyntaxTree parse(String source);
}
