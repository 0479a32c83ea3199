package com.scadlang.lsp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 文档管理器
 *
 * <p>管理当前打开的文档内容及其 {@link DocumentState}，对应 LSP 的
 * textDocument/didOpen、didChange、didClose。单线程使用。</p>
 */
public class DocumentManager {
    private static final Logger LOG = Logger.getLogger(DocumentManager.class.getName());

    /** URI -> 文档内容 */
    private final Map<String, String> documents = new LinkedHashMap<>();

    /** URI -> 最近一次解析结果 */
    private final Map<String, DocumentState> states = new LinkedHashMap<>();

    private DocumentDriver driver;

    public DocumentManager(DocumentDriver driver) {
        this.driver = driver;
    }

    /**
     * 替换驱动（initialize 时根据客户端配置重建）。已缓存的结果全部作废。
     */
    public void setDriver(DocumentDriver driver) {
        this.driver = driver;
        for (Map.Entry<String, DocumentState> entry : states.entrySet()) {
            entry.setValue(DocumentState.EMPTY);
        }
    }

    /**
     * 打开文档并立即解析
     */
    public DocumentState open(String uri, String content, long version) {
        documents.put(uri, content);
        states.put(uri, DocumentState.EMPTY);
        LOG.fine("打开文档: " + getFileName(uri));
        return refresh(uri, version);
    }

    /**
     * 全量替换文档内容
     */
    public DocumentState change(String uri, String content, long version) {
        documents.put(uri, content);
        return refresh(uri, version);
    }

    public void close(String uri) {
        documents.remove(uri);
        states.remove(uri);
        LOG.fine("关闭文档: " + getFileName(uri));
    }

    public String getContent(String uri) {
        return documents.get(uri);
    }

    /**
     * 获取文档当前状态；未打开的文档返回 null
     */
    public DocumentState getState(String uri) {
        return states.get(uri);
    }

    public boolean isOpen(String uri) {
        return documents.containsKey(uri);
    }

    public Set<String> getOpenDocuments() {
        return Collections.unmodifiableSet(documents.keySet());
    }

    private DocumentState refresh(String uri, long version) {
        DocumentState previous = states.get(uri);
        DocumentState next = driver.update(previous, documents.get(uri), version);
        states.put(uri, next);
        return next;
    }

    /**
     * 从 URI 中取文件名
     */
    public static String getFileName(String uri) {
        // file:///path/to/part.scad -> part.scad
        int lastSlash = uri.lastIndexOf('/');
        if (lastSlash >= 0) {
            return uri.substring(lastSlash + 1);
        }
        return uri;
    }
}
