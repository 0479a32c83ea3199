package com.scadlang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.scadlang.compiler.adapter.AdapterConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

import static com.scadlang.lsp.LspConstants.*;

/**
 * OpenSCAD Language Server
 *
 * <p>通过 stdin/stdout 与编辑器通信，向编辑器侧的协作者提供：</p>
 * <ul>
 *   <li>语法错误诊断（打开、修改文档时发布）</li>
 *   <li>{@code scad/ast}：文档当前版本的 AST（JSON）</li>
 *   <li>{@code scad/syntaxTree}：文档当前版本的具体语法树（S 表达式）</li>
 * </ul>
 *
 * <p>消息按到达顺序同步处理。</p>
 */
public class ScadLanguageServer {
    private static final Logger LOG = Logger.getLogger(ScadLanguageServer.class.getName());

    public static final String SERVER_NAME = "scad-lsp";
    public static final String SERVER_VERSION = "1.0.0";

    private final JsonRpcTransport transport;
    private final DocumentManager documents;
    private final AstJsonSerializer serializer = new AstJsonSerializer();
    private AdapterConfig config = new AdapterConfig();
    private boolean initialized = false;
    private boolean shutdownRequested = false;
    private boolean running = true;

    /** 已见过或已分配的最大版本号，客户端未提供版本号时在其基础上递增 */
    private long localVersion = 0;

    public ScadLanguageServer(InputStream input, OutputStream output) {
        this.transport = new JsonRpcTransport(input, output);
        this.documents = new DocumentManager(new DocumentDriver(config));
    }

    /**
     * 启动服务器主循环，直到收到 exit 或输入流结束
     */
    public void run() {
        LOG.info("OpenSCAD LSP 服务器启动");

        while (running) {
            JsonObject message = null;
            try {
                message = transport.readMessage();
                if (message == null) {
                    break;
                }
                handleMessage(message);
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "处理消息时出错", e);
                // 对带有 id 的请求发送错误响应，确保客户端不会挂起
                if (message != null && message.has("id")) {
                    try {
                        String errMsg = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                        transport.sendError(message.get("id"), ERR_INTERNAL, "Internal error: " + errMsg);
                    } catch (IOException ioEx) {
                        LOG.log(Level.SEVERE, "发送错误响应失败", ioEx);
                    }
                }
            }
        }

        LOG.info("OpenSCAD LSP 服务器关闭");
    }

    private void handleMessage(JsonObject message) throws IOException {
        String method = message.has("method") ? message.get("method").getAsString() : null;
        JsonElement id = message.get("id");

        // 无 method 的消息：有 id 为无效请求，否则是客户端的响应，忽略
        if (method == null) {
            if (id != null) {
                transport.sendError(id, ERR_INVALID_REQUEST, "Missing 'method' field");
            }
            return;
        }

        if (shutdownRequested && !"exit".equals(method)) {
            if (id != null) {
                transport.sendError(id, ERR_INVALID_REQUEST, "Server is shutting down");
            }
            return;
        }

        switch (method) {
            // === 生命周期 ===
            case "initialize":
                handleInitialize(id, message.getAsJsonObject("params"));
                break;
            case "initialized":
                initialized = true;
                break;
            case "shutdown":
                shutdownRequested = true;
                transport.sendResponse(id, JsonNull.INSTANCE);
                break;
            case "exit":
                running = false;
                break;

            // === 文档同步 ===
            case "textDocument/didOpen":
                handleDidOpen(message.getAsJsonObject("params"));
                break;
            case "textDocument/didChange":
                handleDidChange(message.getAsJsonObject("params"));
                break;
            case "textDocument/didClose":
                handleDidClose(message.getAsJsonObject("params"));
                break;

            // === 扩展请求 ===
            case "scad/ast":
                handleAst(id, message.getAsJsonObject("params"));
                break;
            case "scad/syntaxTree":
                handleSyntaxTree(id, message.getAsJsonObject("params"));
                break;

            default:
                if (id != null) {
                    transport.sendError(id, ERR_METHOD_NOT_FOUND, "Method not found: " + method);
                }
                break;
        }
    }

    // ============ initialize ============

    private void handleInitialize(JsonElement id, JsonObject params) throws IOException {
        config = readConfig(params);
        documents.setDriver(new DocumentDriver(config));
        LOG.info("适配配置: diameterMode=" + config.getDiameterMode() + ", strictCallees=" + config.isStrictCallees());

        JsonObject capabilities = new JsonObject();
        JsonObject textDocumentSync = new JsonObject();
        textDocumentSync.addProperty("openClose", true);
        textDocumentSync.addProperty("change", SYNC_FULL);
        capabilities.add("textDocumentSync", textDocumentSync);

        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);

        JsonObject result = new JsonObject();
        result.add("capabilities", capabilities);
        result.add("serverInfo", serverInfo);
        transport.sendResponse(id, result);
    }

    /**
     * 从 initializationOptions 读取适配配置，无法识别的值保留默认
     */
    private AdapterConfig readConfig(JsonObject params) {
        AdapterConfig result = new AdapterConfig();
        if (params == null || !params.has("initializationOptions")
                || !params.get("initializationOptions").isJsonObject()) {
            return result;
        }
        InitializationOptions options;
        try {
            options = transport.getGson().fromJson(params.get("initializationOptions"), InitializationOptions.class);
        } catch (JsonParseException e) {
            LOG.log(Level.WARNING, "initializationOptions 格式错误，使用默认配置", e);
            return result;
        }
        if (options.diameterMode != null) {
            try {
                result.setDiameterMode(AdapterConfig.DiameterMode.valueOf(options.diameterMode.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                LOG.warning("未知的 diameterMode: " + options.diameterMode);
            }
        }
        if (options.strictCallees != null) {
            result.setStrictCallees(options.strictCallees);
        }
        return result;
    }

    /** initializationOptions 的 Gson 映射 */
    static final class InitializationOptions {
        String diameterMode;
        Boolean strictCallees;
    }

    // ============ 文档同步 ============

    private void handleDidOpen(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        String text = textDocument.has("text") ? textDocument.get("text").getAsString() : "";

        DocumentState state = documents.open(uri, text, versionOf(uri, textDocument));
        publishDiagnostics(uri, SyntaxDiagnostics.of(state));
    }

    private void handleDidChange(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        if (!documents.isOpen(uri)) {
            LOG.warning("修改未打开的文档: " + uri);
            return;
        }

        JsonArray changes = params.getAsJsonArray("contentChanges");
        if (changes == null || changes.size() == 0) return;

        // 全量同步：最后一个变更即为完整内容
        JsonObject last = changes.get(changes.size() - 1).getAsJsonObject();
        if (!last.has("text")) return;
        DocumentState state = documents.change(uri, last.get("text").getAsString(), versionOf(uri, textDocument));
        publishDiagnostics(uri, SyntaxDiagnostics.of(state));
    }

    private void handleDidClose(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        documents.close(uri);

        // 清除诊断
        publishDiagnostics(uri, new JsonArray());
    }

    /**
     * 取客户端版本号；缺省时分配一个不与该文档缓存版本冲突的新版本，
     * 保证无版本号的变更总会重新转换。
     */
    private long versionOf(String uri, JsonObject textDocument) {
        JsonElement version = textDocument.get("version");
        if (version != null && version.isJsonPrimitive() && version.getAsJsonPrimitive().isNumber()) {
            long clientVersion = version.getAsLong();
            localVersion = Math.max(localVersion, clientVersion);
            return clientVersion;
        }
        DocumentState previous = documents.getState(uri);
        long base = previous != null && !previous.isEmpty() ? previous.getVersionId() : localVersion;
        localVersion = Math.max(localVersion, base) + 1;
        return localVersion;
    }

    // ============ scad/ast, scad/syntaxTree ============

    private void handleAst(JsonElement id, JsonObject params) throws IOException {
        String uri = requireUri(id, params);
        if (uri == null) return;
        DocumentState state = documents.getState(uri);
        if (state == null || state.isEmpty()) {
            transport.sendResponse(id, JsonNull.INSTANCE);
            return;
        }
        transport.sendResponse(id, serializer.toJson(state.getAst()));
    }

    private void handleSyntaxTree(JsonElement id, JsonObject params) throws IOException {
        String uri = requireUri(id, params);
        if (uri == null) return;
        DocumentState state = documents.getState(uri);
        if (state == null || state.getSyntaxTree() == null) {
            transport.sendResponse(id, JsonNull.INSTANCE);
            return;
        }
        transport.sendResponse(id, new JsonPrimitive(state.getSyntaxTree().getRootNode().toString()));
    }

    /**
     * 读取 {@code params.textDocument.uri}，缺失时回复 invalid params 并返回 null
     */
    private String requireUri(JsonElement id, JsonObject params) throws IOException {
        JsonObject textDocument = params != null ? params.getAsJsonObject("textDocument") : null;
        if (textDocument == null || !textDocument.has("uri")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument.uri");
            return null;
        }
        return textDocument.get("uri").getAsString();
    }

    private void publishDiagnostics(String uri, JsonArray diagnostics) throws IOException {
        JsonObject params = new JsonObject();
        params.addProperty("uri", uri);
        params.add("diagnostics", diagnostics);
        transport.sendNotification("textDocument/publishDiagnostics", params);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public AdapterConfig getConfig() {
        return config;
    }

    DocumentManager getDocuments() {
        return documents;
    }

    // ============ 入口 ============

    public static void main(String[] args) {
        // 日志输出到 stderr，不干扰 stdin/stdout 上的 LSP 通信
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.INFO);
        rootLogger.addHandler(stderrHandler);

        ScadLanguageServer server = new ScadLanguageServer(System.in, System.out);
        server.run();
    }
}
