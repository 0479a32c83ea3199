package com.scadlang.lsp;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonRpcTransport 测试")
class JsonRpcTransportTest {

    /**
     * 构建 LSP 格式的消息字节（Content-Length header + \r\n\r\n + body）
     */
    private byte[] buildMessage(String jsonBody) {
        byte[] bodyBytes = jsonBody.getBytes(StandardCharsets.UTF_8);
        String header = "Content-Length: " + bodyBytes.length + "\r\n\r\n";
        byte[] headerBytes = header.getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[headerBytes.length + bodyBytes.length];
        System.arraycopy(headerBytes, 0, result, 0, headerBytes.length);
        System.arraycopy(bodyBytes, 0, result, headerBytes.length, bodyBytes.length);
        return result;
    }

    private JsonRpcTransport reader(byte[] input) {
        return new JsonRpcTransport(new ByteArrayInputStream(input), new ByteArrayOutputStream());
    }

    @Nested
    @DisplayName("readMessage")
    class ReadMessage {

        @Test
        @DisplayName("读取请求")
        void testReadRequest() throws IOException {
            String json = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"scad/ast\",\"params\":{}}";

            JsonObject msg = reader(buildMessage(json)).readMessage();

            assertThat(msg).isNotNull();
            assertThat(msg.get("id").getAsInt()).isEqualTo(1);
            assertThat(msg.get("method").getAsString()).isEqualTo("scad/ast");
        }

        @Test
        @DisplayName("空输入流返回 null")
        void testEmptyStream() throws IOException {
            assertThat(reader(new byte[0]).readMessage()).isNull();
        }

        @Test
        @DisplayName("连续读取多条消息")
        void testMultipleMessages() throws IOException {
            byte[] first = buildMessage("{\"method\":\"a\"}");
            byte[] second = buildMessage("{\"method\":\"b\"}");
            byte[] input = new byte[first.length + second.length];
            System.arraycopy(first, 0, input, 0, first.length);
            System.arraycopy(second, 0, input, first.length, second.length);
            JsonRpcTransport transport = reader(input);

            assertThat(transport.readMessage().get("method").getAsString()).isEqualTo("a");
            assertThat(transport.readMessage().get("method").getAsString()).isEqualTo("b");
            assertThat(transport.readMessage()).isNull();
        }

        @Test
        @DisplayName("忽略额外头部并按字节计算长度")
        void testExtraHeaderAndMultibyteBody() throws IOException {
            String json = "{\"text\":\"立方体\"}";
            byte[] body = json.getBytes(StandardCharsets.UTF_8);
            String header = "Content-Type: application/vscode-jsonrpc; charset=utf-8\r\n"
                    + "Content-Length: " + body.length + "\r\n\r\n";
            byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);
            byte[] input = new byte[headerBytes.length + body.length];
            System.arraycopy(headerBytes, 0, input, 0, headerBytes.length);
            System.arraycopy(body, 0, input, headerBytes.length, body.length);

            JsonObject msg = reader(input).readMessage();

            assertThat(msg.get("text").getAsString()).isEqualTo("立方体");
        }

        @Test
        @DisplayName("非法 Content-Length 抛出 IOException")
        void testInvalidContentLength() {
            byte[] input = "Content-Length: abc\r\n\r\n{}".getBytes(StandardCharsets.US_ASCII);

            assertThatThrownBy(() -> reader(input).readMessage())
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("abc");
        }

        @Test
        @DisplayName("正文不完整返回 null")
        void testTruncatedBody() throws IOException {
            byte[] input = "Content-Length: 50\r\n\r\n{\"id\":1}".getBytes(StandardCharsets.US_ASCII);

            assertThat(reader(input).readMessage()).isNull();
        }
    }

    @Nested
    @DisplayName("写入消息")
    class WriteMessage {

        private JsonObject roundTrip(ByteArrayOutputStream out) throws IOException {
            return reader(out.toByteArray()).readMessage();
        }

        @Test
        @DisplayName("响应携带 id 与 result")
        void testSendResponse() throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            JsonRpcTransport transport = new JsonRpcTransport(new ByteArrayInputStream(new byte[0]), out);

            transport.sendResponse(new JsonPrimitive(3), JsonNull.INSTANCE);

            String raw = new String(out.toByteArray(), StandardCharsets.UTF_8);
            assertThat(raw).startsWith("Content-Length: ");
            JsonObject msg = roundTrip(out);
            assertThat(msg.get("jsonrpc").getAsString()).isEqualTo("2.0");
            assertThat(msg.get("id").getAsInt()).isEqualTo(3);
            assertThat(msg.has("result")).isTrue();
            assertThat(msg.get("result").isJsonNull()).isTrue();
        }

        @Test
        @DisplayName("错误响应携带 code 与 message")
        void testSendError() throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            JsonRpcTransport transport = new JsonRpcTransport(new ByteArrayInputStream(new byte[0]), out);

            transport.sendError(new JsonPrimitive(4), LspConstants.ERR_METHOD_NOT_FOUND, "Method not found: x");

            JsonObject error = roundTrip(out).getAsJsonObject("error");
            assertThat(error.get("code").getAsInt()).isEqualTo(-32601);
            assertThat(error.get("message").getAsString()).isEqualTo("Method not found: x");
        }

        @Test
        @DisplayName("通知没有 id")
        void testSendNotification() throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            JsonRpcTransport transport = new JsonRpcTransport(new ByteArrayInputStream(new byte[0]), out);
            JsonObject params = new JsonObject();
            params.addProperty("uri", "file:///a.scad");

            transport.sendNotification("textDocument/publishDiagnostics", params);

            JsonObject msg = roundTrip(out);
            assertThat(msg.has("id")).isFalse();
            assertThat(msg.get("method").getAsString()).isEqualTo("textDocument/publishDiagnostics");
            assertThat(msg.getAsJsonObject("params").get("uri").getAsString()).isEqualTo("file:///a.scad");
        }
    }
}
