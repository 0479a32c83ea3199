package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.SyntaxTree;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.List;

/**
 * CST 到 AST 的遍历入口
 *
 * <p>每次适配都获取一个游标：识别种类、查表、调用适配函数，最后在 finally 中关闭游标，
 * 适配函数抛出的异常在关闭之后原样传播。子节点通过 {@link ChildAdapter} 以新游标重复同一流程。</p>
 *
 * <p>Program 节点额外收集全部命名子节点（跳过 {@code ;} 等标点）作为 children，
 * 与根适配函数自身返回的字段无关。</p>
 */
public class CursorTraversal {
    private static final String PARENTHESIZED = "parenthesized_expression";

    private final AdapterRegistry registry;
    private final NodeTypeDetector detector;
    private final AdapterConfig config;
    private final ChildAdapter childAdapter = new Recurse();

    public CursorTraversal() {
        this(AdapterRegistry.standard(), new AdapterConfig());
    }

    public CursorTraversal(AdapterConfig config) {
        this(AdapterRegistry.standard(), config);
    }

    public CursorTraversal(AdapterRegistry registry, AdapterConfig config) {
        this.registry = registry;
        this.config = config;
        this.detector = new NodeTypeDetector(config.isStrictCallees());
    }

    public AstNode adapt(SyntaxTree tree) {
        return adapt(tree.getRootNode());
    }

    public AstNode adapt(SyntaxNode node) {
        return adapt(unwrap(node).walk());
    }

    /**
     * 适配游标当前所在的节点，并接管游标：无论成功或异常都会关闭它
     */
    public AstNode adapt(TreeCursor cursor) {
        try {
            SyntaxNode root = cursor.currentNode();
            NodeKind kind = detector.detect(root);
            AstNode result = registry.lookup(kind).adapt(cursor, childAdapter);
            if (result == null) {
                throw new IllegalStateException("adapter for " + kind + " returned null");
            }
            if (kind == NodeKind.PROGRAM) {
                cursor.reset(root);
                result = new Program(result.getPosition(), adaptNamedChildren(cursor));
            }
            return result;
        } finally {
            cursor.close();
        }
    }

    public AdapterRegistry getRegistry() {
        return registry;
    }

    public AdapterConfig getConfig() {
        return config;
    }

    private List<AstNode> adaptNamedChildren(TreeCursor cursor) {
        List<AstNode> children = new ArrayList<>();
        if (!cursor.gotoFirstChild()) {
            return children;
        }
        do {
            if (cursor.isNodeNamed()) {
                children.add(adapt(cursor.currentNode()));
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return children;
    }

    private Expression adaptExpression(SyntaxNode node) {
        SyntaxNode target = unwrap(node);
        AstNode result = adapt(target);
        if (result instanceof Expression) {
            return (Expression) result;
        }
        if (NodeTypeDetector.isCallWrapper(target.getType())) {
            // 表达式位置上的 cube(...) 等按普通函数调用处理
            TreeCursor cursor = target.walk();
            try {
                AstNode call = registry.lookup(NodeKind.CALL_EXPRESSION).adapt(cursor, childAdapter);
                if (call instanceof Expression) {
                    return (Expression) call;
                }
            } finally {
                cursor.close();
            }
        }
        return new UnknownNode(PositionExtractor.fromNode(target));
    }

    /** 括号表达式对适配透明 */
    private static SyntaxNode unwrap(SyntaxNode node) {
        SyntaxNode current = node;
        while (PARENTHESIZED.equals(current.getType()) && current.getNamedChildCount() > 0) {
            current = current.getNamedChild(0);
        }
        return current;
    }

    private final class Recurse implements ChildAdapter {

        @Override
        public AstNode adapt(SyntaxNode node) {
            return CursorTraversal.this.adapt(node);
        }

        @Override
        public Expression adaptExpression(SyntaxNode node) {
            return CursorTraversal.this.adaptExpression(node);
        }

        @Override
        public AdapterConfig config() {
            return config;
        }
    }
}
