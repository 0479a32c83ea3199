package com.scadlang.compiler.cst;

/**
 * 语法树游标
 *
 * <p>显式前进（首子节点 / 下一兄弟 / 父节点）的遍历句柄。游标是需要释放的资源：
 * 关闭后任何导航或读取都会抛出 {@link IllegalStateException}，重复关闭无副作用。</p>
 */
public interface TreeCursor extends AutoCloseable {

    SyntaxNode currentNode();

    /** 当前节点在父节点中的字段名，没有时返回 null */
    String currentFieldName();

    default String getNodeType() {
        return currentNode().getType();
    }

    default boolean isNodeNamed() {
        return currentNode().isNamed();
    }

    default Point getStartPoint() {
        return currentNode().getStartPoint();
    }

    default Point getEndPoint() {
        return currentNode().getEndPoint();
    }

    boolean gotoFirstChild();

    boolean gotoNextSibling();

    /** 回到父节点；已在游标根节点时返回 false */
    boolean gotoParent();

    /** 以 node 为新根重新定位游标 */
    void reset(SyntaxNode node);

    boolean isClosed();

    @Override
    void close();
}
