package com.scadlang.lsp;

import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.cst.SyntaxTree;

/**
 * 单个文档在某一版本下的解析结果：版本号、具体语法树与 AST
 *
 * <p>不可变值，由调用方持有并传回 {@link DocumentDriver#update}。</p>
 */
public final class DocumentState {

    /** 尚未解析过任何版本 */
    public static final DocumentState EMPTY = new DocumentState(Long.MIN_VALUE, null, null);

    private final long versionId;
    private final SyntaxTree syntaxTree;
    private final Program ast;

    public DocumentState(long versionId, SyntaxTree syntaxTree, Program ast) {
        this.versionId = versionId;
        this.syntaxTree = syntaxTree;
        this.ast = ast;
    }

    public long getVersionId() {
        return versionId;
    }

    /** 保留的具体语法树，用于需要精确文本位置的操作 */
    public SyntaxTree getSyntaxTree() {
        return syntaxTree;
    }

    public Program getAst() {
        return ast;
    }

    public boolean isEmpty() {
        return ast == null;
    }

    @Override
    public String toString() {
        return "DocumentState{version=" + versionId + ", children="
                + (ast != null ? ast.getChildren().size() : 0) + "}";
    }
}
