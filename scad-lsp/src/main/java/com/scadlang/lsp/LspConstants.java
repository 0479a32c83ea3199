package com.scadlang.lsp;

/**
 * LSP 协议常量定义。
 *
 * @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/">LSP 3.17 Spec</a>
 */
public final class LspConstants {

    private LspConstants() {}

    // ==================== DiagnosticSeverity ====================

    public static final int SEVERITY_ERROR = 1;
    public static final int SEVERITY_WARNING = 2;
    public static final int SEVERITY_INFORMATION = 3;
    public static final int SEVERITY_HINT = 4;

    // ==================== TextDocumentSyncKind ====================

    public static final int SYNC_NONE = 0;
    public static final int SYNC_FULL = 1;

    // ==================== ErrorCodes ====================

    public static final int ERR_INVALID_REQUEST = -32600;
    public static final int ERR_METHOD_NOT_FOUND = -32601;
    public static final int ERR_INVALID_PARAMS = -32602;
    public static final int ERR_INTERNAL = -32603;
}
