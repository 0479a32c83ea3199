package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.ChildAdapter;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.cst.TreeCursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于游标的子节点查找；所有方法返回时游标回到调用前的位置
 */
public final class CursorNavigator {

    private CursorNavigator() {
    }

    /**
     * 当前节点中第一个带指定字段名的子节点
     *
     * @return 子节点，不存在或是 missing 节点时返回 null
     */
    public static SyntaxNode field(TreeCursor cursor, String fieldName) {
        if (!cursor.gotoFirstChild()) {
            return null;
        }
        SyntaxNode found = null;
        do {
            if (fieldName.equals(cursor.currentFieldName())) {
                found = cursor.currentNode();
                break;
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return found != null && !found.isMissing() ? found : null;
    }

    /** 当前节点中指定类型的全部子节点 */
    public static List<SyntaxNode> childrenOfType(TreeCursor cursor, String type) {
        List<SyntaxNode> result = new ArrayList<>();
        if (!cursor.gotoFirstChild()) {
            return result;
        }
        do {
            if (type.equals(cursor.getNodeType())) {
                result.add(cursor.currentNode());
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return result;
    }

    /** 适配当前节点的全部命名子节点，保持源码顺序 */
    public static List<AstNode> adaptNamedChildren(TreeCursor cursor, ChildAdapter children) {
        List<AstNode> result = new ArrayList<>();
        if (!cursor.gotoFirstChild()) {
            return result;
        }
        do {
            if (cursor.isNodeNamed()) {
                result.add(children.adapt(cursor.currentNode()));
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return result;
    }

    /**
     * 适配 fieldName 指向的子语句：块展开为其中的语句，单条语句得到单元素列表，
     * 字段不存在时返回空列表
     */
    public static List<AstNode> body(TreeCursor cursor, ChildAdapter children, String fieldName) {
        List<AstNode> result = bodyOrNull(cursor, children, fieldName);
        return result != null ? result : Collections.<AstNode>emptyList();
    }

    /** 同 {@link #body}，但字段不存在时返回 null */
    public static List<AstNode> bodyOrNull(TreeCursor cursor, ChildAdapter children, String fieldName) {
        if (!cursor.gotoFirstChild()) {
            return null;
        }
        List<AstNode> result = null;
        do {
            if (fieldName.equals(cursor.currentFieldName()) && !cursor.currentNode().isMissing()) {
                if ("block".equals(cursor.getNodeType())) {
                    result = adaptNamedChildren(cursor, children);
                } else {
                    result = new ArrayList<>();
                    result.add(children.adapt(cursor.currentNode()));
                }
                break;
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return result;
    }
}
