package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.cst.SyntaxNode;

/**
 * 递归适配子节点的能力，由 {@link CursorTraversal} 提供给每个适配函数
 */
public interface ChildAdapter {

    /** 以新游标适配子节点，结果不为 null */
    AstNode adapt(SyntaxNode node);

    /**
     * 在表达式位置适配子节点
     *
     * <p>内建几何关键词在表达式位置按普通调用处理；其他非表达式结果降级为 Unknown。</p>
     */
    Expression adaptExpression(SyntaxNode node);

    AdapterConfig config();
}
