package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 节点种类到适配函数的只读映射
 *
 * <p>通过 {@link Builder} 一次构建，之后不可修改；扩展方式是在新的 Builder 中追加条目。
 * 查不到的种类返回固定的兜底适配函数，因此查找永远不会得到 null。</p>
 */
public final class AdapterRegistry {
    private final Map<NodeKind, NodeAdapter> adapters;
    private final NodeAdapter fallback;

    private AdapterRegistry(Map<NodeKind, NodeAdapter> adapters, NodeAdapter fallback) {
        this.adapters = Collections.unmodifiableMap(new EnumMap<>(adapters));
        this.fallback = fallback;
    }

    /** 启动时构建的标准映射表 */
    public static AdapterRegistry standard() {
        return StandardAdapters.REGISTRY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public NodeAdapter lookup(NodeKind kind) {
        NodeAdapter adapter = adapters.get(kind);
        return adapter != null ? adapter : fallback;
    }

    public boolean isRegistered(NodeKind kind) {
        return adapters.containsKey(kind);
    }

    public Set<NodeKind> registeredKinds() {
        return adapters.keySet();
    }

    public NodeAdapter getFallback() {
        return fallback;
    }

    /** 以当前条目为起点的新 Builder，本实例不受影响 */
    public Builder toBuilder() {
        Builder builder = new Builder().fallback(fallback);
        for (Map.Entry<NodeKind, NodeAdapter> entry : adapters.entrySet()) {
            builder.register(entry.getKey(), entry.getValue());
        }
        return builder;
    }

    public static final class Builder {
        private final Map<NodeKind, NodeAdapter> adapters = new EnumMap<>(NodeKind.class);
        private NodeAdapter fallback = UnknownAdapter.INSTANCE;

        private Builder() {
        }

        /** 同一种类重复注册时后者覆盖前者 */
        public Builder register(NodeKind kind, NodeAdapter adapter) {
            if (kind == null || adapter == null) {
                throw new IllegalArgumentException("kind and adapter must not be null");
            }
            adapters.put(kind, adapter);
            return this;
        }

        public Builder fallback(NodeAdapter adapter) {
            if (adapter == null) {
                throw new IllegalArgumentException("fallback adapter must not be null");
            }
            this.fallback = adapter;
            return this;
        }

        public AdapterRegistry build() {
            return new AdapterRegistry(adapters, fallback);
        }
    }
}
