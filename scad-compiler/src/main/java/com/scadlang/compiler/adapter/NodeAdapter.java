package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.cst.TreeCursor;

/**
 * 单个构造的适配函数
 *
 * <p>cursor 指向匹配的 CST 节点，由调用方持有并负责关闭；适配函数可以移动游标，
 * 但不得关闭或在返回后保留它。返回值不能为 null。</p>
 */
@FunctionalInterface
public interface NodeAdapter {

    AstNode adapt(TreeCursor cursor, ChildAdapter children);
}
