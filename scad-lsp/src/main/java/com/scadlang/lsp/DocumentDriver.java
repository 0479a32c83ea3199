package com.scadlang.lsp;

import com.scadlang.compiler.adapter.AdapterConfig;
import com.scadlang.compiler.adapter.CursorTraversal;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.cst.SyntaxParser;
import com.scadlang.compiler.cst.SyntaxTree;
import com.scadlang.compiler.parser.ScadSyntaxParser;

import java.util.Collections;
import java.util.logging.Logger;

/**
 * 文档级驱动：每个版本执行一次 解析 → 适配
 *
 * <p>缓存由调用方以 {@link DocumentState} 的形式持有，驱动本身无状态，
 * 因此同一个驱动可以服务任意多个文档。</p>
 */
public class DocumentDriver {
    private static final Logger LOG = Logger.getLogger(DocumentDriver.class.getName());

    private final SyntaxParser parser;
    private final CursorTraversal traversal;

    public DocumentDriver() {
        this(new AdapterConfig());
    }

    public DocumentDriver(AdapterConfig config) {
        this(new ScadSyntaxParser(), new CursorTraversal(config));
    }

    public DocumentDriver(SyntaxParser parser, CursorTraversal traversal) {
        this.parser = parser;
        this.traversal = traversal;
    }

    /**
     * 更新文档
     *
     * <p>版本号与 {@code previous} 相同时直接返回 {@code previous}（即使文本不同），
     * 否则重新解析并适配，返回整体替换的新状态。</p>
     *
     * @param previous 上一次的结果，首次调用传 {@link DocumentState#EMPTY}
     * @param sourceText 文档全文
     * @param versionId 调用方提供的单调递增版本号
     */
    public DocumentState update(DocumentState previous, String sourceText, long versionId) {
        DocumentState current = previous != null ? previous : DocumentState.EMPTY;
        if (!current.isEmpty() && current.getVersionId() == versionId) {
            LOG.fine("版本未变化，复用缓存: " + versionId);
            return current;
        }

        SyntaxTree tree = parser.parse(sourceText != null ? sourceText : "");
        AstNode root = traversal.adapt(tree);
        Program program;
        if (root instanceof Program) {
            program = (Program) root;
        } else {
            // 自定义注册表可能为根节点返回其他种类
            program = new Program(root.getPosition(), Collections.singletonList(root));
        }
        LOG.fine("文档已重新适配: version=" + versionId + ", 顶层节点 " + program.getChildren().size());
        return new DocumentState(versionId, tree, program);
    }

    public CursorTraversal getTraversal() {
        return traversal;
    }
}
