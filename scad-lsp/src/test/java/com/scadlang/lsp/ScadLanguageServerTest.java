package com.scadlang.lsp;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.scadlang.compiler.adapter.AdapterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * LSP 服务器集成测试
 *
 * <p>通过 ByteArrayInputStream/ByteArrayOutputStream 模拟客户端，验证完整的请求-响应流程。</p>
 */
@DisplayName("ScadLanguageServer 集成测试")
class ScadLanguageServerTest {
    private static final Gson GSON = new Gson();
    private static final String URI = "file:///models/part.scad";

    // ============ 辅助方法 ============

    private byte[] encode(JsonObject message) {
        byte[] bodyBytes = GSON.toJson(message).getBytes(StandardCharsets.UTF_8);
        byte[] headerBytes = ("Content-Length: " + bodyBytes.length + "\r\n\r\n").getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[headerBytes.length + bodyBytes.length];
        System.arraycopy(headerBytes, 0, result, 0, headerBytes.length);
        System.arraycopy(bodyBytes, 0, result, headerBytes.length, bodyBytes.length);
        return result;
    }

    private JsonObject request(int id, String method, JsonObject params) {
        JsonObject msg = notification(method, params);
        msg.addProperty("id", id);
        return msg;
    }

    private JsonObject notification(String method, JsonObject params) {
        JsonObject msg = new JsonObject();
        msg.addProperty("jsonrpc", "2.0");
        msg.addProperty("method", method);
        msg.add("params", params != null ? params : new JsonObject());
        return msg;
    }

    private JsonObject didOpen(String text, int version) {
        JsonObject textDocument = new JsonObject();
        textDocument.addProperty("uri", URI);
        textDocument.addProperty("languageId", "openscad");
        textDocument.addProperty("version", version);
        textDocument.addProperty("text", text);
        JsonObject params = new JsonObject();
        params.add("textDocument", textDocument);
        return notification("textDocument/didOpen", params);
    }

    private JsonObject didChange(String text, int version) {
        JsonObject message = didChange(text);
        message.getAsJsonObject("params").getAsJsonObject("textDocument").addProperty("version", version);
        return message;
    }

    /** 不带版本号的 didChange */
    private JsonObject didChange(String text) {
        JsonObject textDocument = new JsonObject();
        textDocument.addProperty("uri", URI);
        JsonObject change = new JsonObject();
        change.addProperty("text", text);
        JsonArray changes = new JsonArray();
        changes.add(change);
        JsonObject params = new JsonObject();
        params.add("textDocument", textDocument);
        params.add("contentChanges", changes);
        return notification("textDocument/didChange", params);
    }

    private JsonObject documentParams() {
        JsonObject textDocument = new JsonObject();
        textDocument.addProperty("uri", URI);
        JsonObject params = new JsonObject();
        params.add("textDocument", textDocument);
        return params;
    }

    /**
     * 依次发送消息（最后自动追加 shutdown + exit），运行服务器并返回全部输出消息
     */
    private List<JsonObject> run(ScadLanguageServer[] holder, JsonObject... messages) throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        for (JsonObject message : messages) {
            input.write(encode(message));
        }
        input.write(encode(request(999, "shutdown", null)));
        input.write(encode(notification("exit", null)));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ScadLanguageServer server = new ScadLanguageServer(new ByteArrayInputStream(input.toByteArray()), out);
        server.run();
        if (holder != null) {
            holder[0] = server;
        }

        JsonRpcTransport reader = new JsonRpcTransport(new ByteArrayInputStream(out.toByteArray()), new ByteArrayOutputStream());
        List<JsonObject> result = new ArrayList<>();
        JsonObject msg;
        while ((msg = reader.readMessage()) != null) {
            result.add(msg);
        }
        return result;
    }

    private List<JsonObject> run(JsonObject... messages) throws IOException {
        return run(null, messages);
    }

    private JsonObject findResponse(List<JsonObject> messages, int id) {
        for (JsonObject msg : messages) {
            if (msg.has("id") && !msg.has("method") && msg.get("id").getAsInt() == id) {
                return msg;
            }
        }
        return null;
    }

    private List<JsonObject> findNotifications(List<JsonObject> messages, String method) {
        List<JsonObject> found = new ArrayList<>();
        for (JsonObject msg : messages) {
            if (msg.has("method") && method.equals(msg.get("method").getAsString())) {
                found.add(msg);
            }
        }
        return found;
    }

    // ============ 生命周期 ============

    @Test
    @DisplayName("initialize 返回全量同步能力与服务器信息")
    void testInitialize() throws IOException {
        ScadLanguageServer[] holder = new ScadLanguageServer[1];
        List<JsonObject> messages = run(holder,
                request(1, "initialize", new JsonObject()),
                notification("initialized", null));

        JsonObject result = findResponse(messages, 1).getAsJsonObject("result");
        JsonObject sync = result.getAsJsonObject("capabilities").getAsJsonObject("textDocumentSync");
        assertThat(sync.get("change").getAsInt()).isEqualTo(LspConstants.SYNC_FULL);
        assertThat(sync.get("openClose").getAsBoolean()).isTrue();
        assertThat(result.getAsJsonObject("serverInfo").get("name").getAsString()).isEqualTo("scad-lsp");
        assertThat(holder[0].isInitialized()).isTrue();

        JsonObject shutdown = findResponse(messages, 999);
        assertThat(shutdown.get("result").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("initializationOptions 映射为适配配置")
    void testInitializationOptions() throws IOException {
        JsonObject options = new JsonObject();
        options.addProperty("diameterMode", "halve_expression");
        options.addProperty("strictCallees", true);
        JsonObject params = new JsonObject();
        params.add("initializationOptions", options);

        ScadLanguageServer[] holder = new ScadLanguageServer[1];
        List<JsonObject> messages = run(holder,
                request(1, "initialize", params),
                didOpen("my_part(1);", 1),
                request(2, "scad/ast", documentParams()));

        AdapterConfig config = holder[0].getConfig();
        assertThat(config.getDiameterMode()).isEqualTo(AdapterConfig.DiameterMode.HALVE_EXPRESSION);
        assertThat(config.isStrictCallees()).isTrue();

        JsonObject ast = findResponse(messages, 2).getAsJsonObject("result");
        assertThat(ast.getAsJsonArray("children").get(0).getAsJsonObject().get("type").getAsString())
                .isEqualTo("Unknown");
    }

    @Test
    @DisplayName("未知的 diameterMode 保留默认值")
    void testUnknownDiameterMode() throws IOException {
        JsonObject options = new JsonObject();
        options.addProperty("diameterMode", "sideways");
        JsonObject params = new JsonObject();
        params.add("initializationOptions", options);

        ScadLanguageServer[] holder = new ScadLanguageServer[1];
        run(holder, request(1, "initialize", params));

        assertThat(holder[0].getConfig().getDiameterMode()).isEqualTo(AdapterConfig.DiameterMode.PASS_THROUGH);
    }

    // ============ 诊断 ============

    @Test
    @DisplayName("didOpen 发布语法诊断")
    void testDidOpenPublishesDiagnostics() throws IOException {
        List<JsonObject> messages = run(
                request(1, "initialize", new JsonObject()),
                didOpen("cube(1", 1));

        List<JsonObject> published = findNotifications(messages, "textDocument/publishDiagnostics");
        assertThat(published).hasSize(1);
        JsonObject params = published.get(0).getAsJsonObject("params");
        assertThat(params.get("uri").getAsString()).isEqualTo(URI);
        JsonArray diagnostics = params.getAsJsonArray("diagnostics");
        assertThat(diagnostics.size()).isEqualTo(2);
        assertThat(diagnostics.get(0).getAsJsonObject().get("message").getAsString()).isEqualTo("Missing ')'");
    }

    @Test
    @DisplayName("didChange 修复错误后诊断清空")
    void testDidChangeClearsDiagnostics() throws IOException {
        List<JsonObject> messages = run(
                didOpen("cube(1", 1),
                didChange("cube(1);", 2));

        List<JsonObject> published = findNotifications(messages, "textDocument/publishDiagnostics");
        assertThat(published).hasSize(2);
        assertThat(published.get(0).getAsJsonObject("params").getAsJsonArray("diagnostics").size()).isEqualTo(2);
        assertThat(published.get(1).getAsJsonObject("params").getAsJsonArray("diagnostics").size()).isZero();
    }

    @Test
    @DisplayName("didClose 清除诊断并移除文档")
    void testDidClose() throws IOException {
        JsonObject close = notification("textDocument/didClose", documentParams());
        ScadLanguageServer[] holder = new ScadLanguageServer[1];
        List<JsonObject> messages = run(holder, didOpen("cube(1", 1), close);

        List<JsonObject> published = findNotifications(messages, "textDocument/publishDiagnostics");
        assertThat(published).hasSize(2);
        assertThat(published.get(1).getAsJsonObject("params").getAsJsonArray("diagnostics").size()).isZero();
        assertThat(holder[0].getDocuments().isOpen(URI)).isFalse();
    }

    // ============ scad/ast 与 scad/syntaxTree ============

    @Test
    @DisplayName("scad/ast 返回当前版本的 AST")
    void testAstRequest() throws IOException {
        List<JsonObject> messages = run(
                didOpen("cube(1);", 1),
                didChange("sphere(d=20); cube(2);", 2),
                request(5, "scad/ast", documentParams()));

        JsonObject ast = findResponse(messages, 5).getAsJsonObject("result");
        assertThat(ast.get("type").getAsString()).isEqualTo("Program");
        JsonArray children = ast.getAsJsonArray("children");
        assertThat(children.size()).isEqualTo(2);
        JsonObject sphere = children.get(0).getAsJsonObject();
        assertThat(sphere.get("type").getAsString()).isEqualTo("Sphere3D");
        assertThat(sphere.getAsJsonObject("radius").get("value").getAsDouble()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("相同版本的 didChange 不改变 AST")
    void testSameVersionChangeKeepsAst() throws IOException {
        List<JsonObject> messages = run(
                didOpen("cube(1);", 3),
                didChange("sphere(1); sphere(2);", 3),
                request(5, "scad/ast", documentParams()));

        JsonObject ast = findResponse(messages, 5).getAsJsonObject("result");
        assertThat(ast.getAsJsonArray("children").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("不带版本号的 didChange 总会重新转换")
    void testVersionlessChangeRebuildsAst() throws IOException {
        List<JsonObject> messages = run(
                didOpen("cube(1);", 1),
                didChange("sphere(2); sphere(3);"),
                request(5, "scad/ast", documentParams()),
                didChange("cube(4);"),
                request(6, "scad/ast", documentParams()));

        JsonArray first = findResponse(messages, 5).getAsJsonObject("result").getAsJsonArray("children");
        assertThat(first.size()).isEqualTo(2);
        assertThat(first.get(0).getAsJsonObject().get("type").getAsString()).isEqualTo("Sphere3D");

        JsonArray second = findResponse(messages, 6).getAsJsonObject("result").getAsJsonArray("children");
        assertThat(second.size()).isEqualTo(1);
        assertThat(second.get(0).getAsJsonObject().get("type").getAsString()).isEqualTo("Cube3D");
    }

    @Test
    @DisplayName("scad/syntaxTree 返回 S 表达式")
    void testSyntaxTreeRequest() throws IOException {
        List<JsonObject> messages = run(
                didOpen("include <a.scad>", 1),
                request(6, "scad/syntaxTree", documentParams()));

        assertThat(findResponse(messages, 6).get("result").getAsString())
                .isEqualTo("(program (include_statement path: (include_path)))");
    }

    @Test
    @DisplayName("未打开的文档返回 null")
    void testAstForUnknownDocument() throws IOException {
        List<JsonObject> messages = run(request(7, "scad/ast", documentParams()));

        assertThat(findResponse(messages, 7).get("result").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("缺少 textDocument 返回 invalid params")
    void testAstMissingUri() throws IOException {
        List<JsonObject> messages = run(request(8, "scad/ast", new JsonObject()));

        JsonObject error = findResponse(messages, 8).getAsJsonObject("error");
        assertThat(error.get("code").getAsInt()).isEqualTo(LspConstants.ERR_INVALID_PARAMS);
    }

    // ============ 错误处理 ============

    @Test
    @DisplayName("未知方法返回 method not found")
    void testMethodNotFound() throws IOException {
        List<JsonObject> messages = run(request(9, "textDocument/hover", documentParams()));

        JsonObject error = findResponse(messages, 9).getAsJsonObject("error");
        assertThat(error.get("code").getAsInt()).isEqualTo(LspConstants.ERR_METHOD_NOT_FOUND);
        assertThat(error.get("message").getAsString()).contains("textDocument/hover");
    }

    @Test
    @DisplayName("缺少 method 的请求返回 invalid request")
    void testMissingMethod() throws IOException {
        JsonObject msg = new JsonObject();
        msg.addProperty("jsonrpc", "2.0");
        msg.addProperty("id", 10);

        List<JsonObject> messages = run(msg);

        JsonObject error = findResponse(messages, 10).getAsJsonObject("error");
        assertThat(error.get("code").getAsInt()).isEqualTo(LspConstants.ERR_INVALID_REQUEST);
    }

    @Test
    @DisplayName("未知通知被忽略")
    void testUnknownNotificationIgnored() throws IOException {
        List<JsonObject> messages = run(notification("$/setTrace", null));

        assertThat(messages).hasSize(1);
        assertThat(findResponse(messages, 999)).isNotNull();
    }
}
