package com.scadlang.compiler.cst;

import java.util.List;

/**
 * 具体语法树节点
 *
 * <p>节点在一次解析的生命周期内不可变。命名子节点是语义子节点，
 * 匿名子节点是标点、关键字等 token，其类型即 token 文本。</p>
 */
public interface SyntaxNode {

    /** 错误恢复时包裹无法解析内容的节点类型 */
    String ERROR_TYPE = "ERROR";

    String getType();

    boolean isNamed();

    /** 由错误恢复插入的零宽节点 */
    boolean isMissing();

    default boolean isError() {
        return ERROR_TYPE.equals(getType());
    }

    Point getStartPoint();

    Point getEndPoint();

    int getStartByte();

    int getEndByte();

    String getText();

    int getChildCount();

    SyntaxNode getChild(int index);

    int getNamedChildCount();

    SyntaxNode getNamedChild(int index);

    List<SyntaxNode> getChildren();

    List<SyntaxNode> getNamedChildren();

    /**
     * 按字段名查找第一个子节点
     *
     * @return 子节点，不存在时返回 null
     */
    SyntaxNode getChildByFieldName(String fieldName);

    /** 第 index 个子节点的字段名，没有字段名时返回 null */
    String getFieldNameForChild(int index);

    /** 创建以本节点为根的游标，调用方负责关闭 */
    TreeCursor walk();
}
