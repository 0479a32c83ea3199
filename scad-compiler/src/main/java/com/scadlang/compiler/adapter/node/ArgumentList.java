package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用节点的实参表
 *
 * <p>位置下标只计算未命名的实参；同一参数既有命名又有位置形式时命名优先；
 * 未识别的名称由调用方忽略。</p>
 */
public final class ArgumentList {
    private static final ArgumentList EMPTY = new ArgumentList(Collections.<Entry>emptyList());

    private final List<Entry> entries;

    private ArgumentList(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * 读取游标所在调用节点的 arguments 子节点，返回时游标回到原位置
     */
    public static ArgumentList read(TreeCursor cursor) {
        if (!cursor.gotoFirstChild()) {
            return EMPTY;
        }
        List<Entry> entries = new ArrayList<>();
        do {
            if ("arguments".equals(cursor.currentFieldName()) || "arguments".equals(cursor.getNodeType())) {
                collect(cursor, entries);
                break;
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return new ArgumentList(entries);
    }

    private static void collect(TreeCursor cursor, List<Entry> entries) {
        if (!cursor.gotoFirstChild()) {
            return;
        }
        do {
            if (!cursor.isNodeNamed()) {
                continue;
            }
            SyntaxNode node = cursor.currentNode();
            if ("argument".equals(node.getType())) {
                SyntaxNode name = node.getChildByFieldName("name");
                SyntaxNode value = node.getChildByFieldName("value");
                entries.add(new Entry(node, name != null && !name.isMissing() ? name.getText() : null, value));
            } else {
                // 没有 argument 包装的文法：直接视为位置参数
                entries.add(new Entry(node, null, node));
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean has(String name) {
        return findNamed(name) != null;
    }

    /** 命名实参的值，不存在或缺少值时返回 null */
    public SyntaxNode named(String name) {
        Entry entry = findNamed(name);
        return entry != null ? entry.getValue() : null;
    }

    /** 第 index 个未命名实参的值 */
    public SyntaxNode positional(int index) {
        int seen = 0;
        for (Entry entry : entries) {
            if (entry.isNamed()) {
                continue;
            }
            if (seen == index) {
                return entry.getValue();
            }
            seen++;
        }
        return null;
    }

    /**
     * 按名称取值，没有命名形式时退回到位置参数
     *
     * @param position 位置下标，负数表示只接受命名形式
     */
    public SyntaxNode get(String name, int position) {
        if (has(name)) {
            return named(name);
        }
        return position >= 0 ? positional(position) : null;
    }

    private Entry findNamed(String name) {
        for (Entry entry : entries) {
            if (name.equals(entry.getName())) {
                return entry;
            }
        }
        return null;
    }

    public static final class Entry {
        private final SyntaxNode node;
        private final String name;
        private final SyntaxNode value;

        Entry(SyntaxNode node, String name, SyntaxNode value) {
            this.node = node;
            this.name = name;
            this.value = value != null && !value.isMissing() ? value : null;
        }

        public SyntaxNode getNode() {
            return node;
        }

        public String getName() {
            return name;
        }

        public SyntaxNode getValue() {
            return value;
        }

        public boolean isNamed() {
            return name != null;
        }
    }
}
