package com.scadlang.compiler.parser;

import com.scadlang.compiler.cst.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 按顺序收集子节点及其字段名
 */
final class NodeBuilder {
    private final List<CstNode> children = new ArrayList<CstNode>();
    private final List<String> fieldNames = new ArrayList<String>();

    NodeBuilder add(CstNode child) {
        return add(null, child);
    }

    /** child 为 null 时忽略，便于可选部分直接传入 */
    NodeBuilder add(String fieldName, CstNode child) {
        if (child != null) {
            children.add(child);
            fieldNames.add(fieldName);
        }
        return this;
    }

    boolean isEmpty() {
        return children.isEmpty();
    }

    List<CstNode> getChildren() {
        return children;
    }

    List<String> getFieldNames() {
        return fieldNames;
    }

    CstNode build(String type, String source) {
        return CstNode.branch(type, source, children, fieldNames);
    }
}
