package com.scadlang.lsp;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * JSON-RPC 2.0 传输层
 *
 * <p>按 LSP base protocol 读写消息：{@code Content-Length} 头部、空行、UTF-8 正文。</p>
 */
public class JsonRpcTransport {
    private static final String CONTENT_LENGTH = "Content-Length:";

    private final InputStream input;
    private final OutputStream output;
    private final Gson gson;

    public JsonRpcTransport(InputStream input, OutputStream output) {
        this.input = input;
        this.output = output;
        this.gson = new GsonBuilder().serializeNulls().create();
    }

    /**
     * 读取一条消息
     *
     * @return 消息对象；输入流结束时返回 null
     * @throws IOException 头部或正文格式错误
     */
    public JsonObject readMessage() throws IOException {
        int contentLength = -1;
        String line;
        while ((line = readHeaderLine()) != null) {
            if (line.isEmpty()) {
                break;
            }
            if (line.regionMatches(true, 0, CONTENT_LENGTH, 0, CONTENT_LENGTH.length())) {
                String value = line.substring(CONTENT_LENGTH.length()).trim();
                try {
                    contentLength = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid Content-Length: " + value, e);
                }
            }
            // 其他头部（Content-Type 等）忽略
        }

        if (contentLength < 0) {
            return null;
        }

        byte[] body = new byte[contentLength];
        int offset = 0;
        while (offset < contentLength) {
            int read = input.read(body, offset, contentLength - offset);
            if (read < 0) {
                return null;
            }
            offset += read;
        }

        try {
            return gson.fromJson(new String(body, StandardCharsets.UTF_8), JsonObject.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON-RPC body", e);
        }
    }

    public void sendResponse(JsonElement id, JsonElement result) throws IOException {
        JsonObject response = envelope();
        response.add("id", id);
        response.add("result", result);
        writeMessage(response);
    }

    public void sendError(JsonElement id, int code, String message) throws IOException {
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);

        JsonObject response = envelope();
        response.add("id", id);
        response.add("error", error);
        writeMessage(response);
    }

    /**
     * 发送通知（无 id）
     */
    public void sendNotification(String method, JsonElement params) throws IOException {
        JsonObject notification = envelope();
        notification.addProperty("method", method);
        notification.add("params", params);
        writeMessage(notification);
    }

    public Gson getGson() {
        return gson;
    }

    private static JsonObject envelope() {
        JsonObject message = new JsonObject();
        message.addProperty("jsonrpc", "2.0");
        return message;
    }

    private synchronized void writeMessage(JsonObject message) throws IOException {
        byte[] body = gson.toJson(message).getBytes(StandardCharsets.UTF_8);
        String header = CONTENT_LENGTH + " " + body.length + "\r\n\r\n";
        output.write(header.getBytes(StandardCharsets.US_ASCII));
        output.write(body);
        output.flush();
    }

    /**
     * 读取一行头部（以 \r\n 结尾，返回值不含行尾）。流结束且无内容时返回 null。
     */
    private String readHeaderLine() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int prev = -1;
        while (true) {
            int c = input.read();
            if (c < 0) {
                return buffer.size() > 0 ? buffer.toString("US-ASCII") : null;
            }
            if (c == '\n' && prev == '\r') {
                byte[] bytes = buffer.toByteArray();
                return new String(bytes, 0, bytes.length - 1, StandardCharsets.US_ASCII);
            }
            buffer.write(c);
            prev = c;
        }
    }
}
