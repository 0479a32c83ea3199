package com.scadlang.compiler.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link SyntaxNode} 的内存实现
 *
 * <p>节点不持有父引用，向上导航由 {@link CstTreeCursor} 的帧栈负责。
 * 文本按需从共享源码中截取，偏移以 UTF-16 代码单元计。</p>
 */
public final class CstNode implements SyntaxNode {
    private final String type;
    private final boolean named;
    private final boolean missing;
    private final String source;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;
    private final List<CstNode> children;
    private final List<String> fieldNames;
    private final List<SyntaxNode> namedChildren;

    private CstNode(String type, boolean named, boolean missing, String source,
                    int startByte, int endByte, Point startPoint, Point endPoint,
                    List<CstNode> children, List<String> fieldNames) {
        if (children.size() != fieldNames.size()) {
            throw new IllegalArgumentException("children and field names differ in size");
        }
        this.type = type;
        this.named = named;
        this.missing = missing;
        this.source = source;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.children = Collections.unmodifiableList(new ArrayList<CstNode>(children));
        this.fieldNames = Collections.unmodifiableList(new ArrayList<String>(fieldNames));
        List<SyntaxNode> namedList = new ArrayList<SyntaxNode>();
        for (CstNode child : children) {
            if (child.named) {
                namedList.add(child);
            }
        }
        this.namedChildren = Collections.unmodifiableList(namedList);
    }

    // ============ 工厂方法 ============

    public static CstNode leaf(String type, boolean named, String source,
                               int startByte, int endByte, Point start, Point end) {
        return new CstNode(type, named, false, source, startByte, endByte, start, end,
                Collections.<CstNode>emptyList(), Collections.<String>emptyList());
    }

    /** 错误恢复插入的零宽节点 */
    public static CstNode missing(String type, boolean named, String source, int atByte, Point at) {
        return new CstNode(type, named, true, source, atByte, atByte, at, at,
                Collections.<CstNode>emptyList(), Collections.<String>emptyList());
    }

    /**
     * 以子节点的首尾作为范围构造分支节点
     *
     * @param fieldNames 与 children 等长，无字段名的位置为 null
     */
    public static CstNode branch(String type, String source, List<CstNode> children, List<String> fieldNames) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("branch '" + type + "' needs at least one child");
        }
        CstNode first = children.get(0);
        CstNode last = children.get(children.size() - 1);
        return new CstNode(type, true, false, source, first.startByte, last.endByte,
                first.startPoint, last.endPoint, children, fieldNames);
    }

    /** 显式指定范围的分支节点（可为空） */
    public static CstNode branch(String type, String source, List<CstNode> children, List<String> fieldNames,
                                 int startByte, int endByte, Point start, Point end) {
        return new CstNode(type, true, false, source, startByte, endByte, start, end, children, fieldNames);
    }

    // ============ SyntaxNode ============

    @Override
    public String getType() {
        return type;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public Point getStartPoint() {
        return startPoint;
    }

    @Override
    public Point getEndPoint() {
        return endPoint;
    }

    @Override
    public int getStartByte() {
        return startByte;
    }

    @Override
    public int getEndByte() {
        return endByte;
    }

    @Override
    public String getText() {
        if (source == null) {
            return "";
        }
        int from = Math.min(startByte, source.length());
        int to = Math.min(endByte, source.length());
        return source.substring(from, to);
    }

    @Override
    public int getChildCount() {
        return children.size();
    }

    @Override
    public CstNode getChild(int index) {
        return children.get(index);
    }

    @Override
    public int getNamedChildCount() {
        return namedChildren.size();
    }

    @Override
    public SyntaxNode getNamedChild(int index) {
        return namedChildren.get(index);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.<SyntaxNode>unmodifiableList(children);
    }

    @Override
    public List<SyntaxNode> getNamedChildren() {
        return namedChildren;
    }

    @Override
    public SyntaxNode getChildByFieldName(String fieldName) {
        for (int i = 0; i < children.size(); i++) {
            if (fieldName.equals(fieldNames.get(i))) {
                return children.get(i);
            }
        }
        return null;
    }

    @Override
    public String getFieldNameForChild(int index) {
        return fieldNames.get(index);
    }

    @Override
    public TreeCursor walk() {
        return new CstTreeCursor(this);
    }

    /**
     * S 表达式形式，只输出命名节点，例如
     * {@code (program (module_instantiation (identifier) arguments: (arguments)))}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendSExpression(sb);
        return sb.toString();
    }

    private void appendSExpression(StringBuilder sb) {
        if (missing) {
            sb.append("(MISSING ").append(type).append(')');
            return;
        }
        sb.append('(').append(type);
        for (int i = 0; i < children.size(); i++) {
            CstNode child = children.get(i);
            if (!child.named) {
                continue;
            }
            sb.append(' ');
            String field = fieldNames.get(i);
            if (field != null) {
                sb.append(field).append(": ");
            }
            child.appendSExpression(sb);
        }
        sb.append(')');
    }
}
