package com.scadlang.compiler.adapter;

import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.Position;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AdapterRegistry 单元测试
 */
class AdapterRegistryTest {

    private static final NodeAdapter MARKER = (cursor, children) -> new UnknownNode(new Position(9, 9, 9, 9));

    @Test
    @DisplayName("标准映射表覆盖所有种类")
    void testStandardCoversAllKinds() {
        AdapterRegistry registry = AdapterRegistry.standard();
        assertThat(registry.registeredKinds()).containsExactlyInAnyOrderElementsOf(EnumSet.allOf(NodeKind.class));
        assertSame(UnknownAdapter.INSTANCE, registry.lookup(NodeKind.UNKNOWN));
        assertSame(registry, AdapterRegistry.standard());
    }

    @Test
    @DisplayName("未注册的种类返回兜底适配函数")
    void testFallback() {
        AdapterRegistry registry = AdapterRegistry.builder().register(NodeKind.CUBE, MARKER).build();
        assertSame(MARKER, registry.lookup(NodeKind.CUBE));
        assertSame(UnknownAdapter.INSTANCE, registry.lookup(NodeKind.SPHERE));
        assertFalse(registry.isRegistered(NodeKind.SPHERE));
        assertSame(UnknownAdapter.INSTANCE, registry.getFallback());
    }

    @Test
    @DisplayName("自定义兜底")
    void testCustomFallback() {
        AdapterRegistry registry = AdapterRegistry.builder().fallback(MARKER).build();
        assertSame(MARKER, registry.lookup(NodeKind.PROGRAM));
        assertTrue(registry.registeredKinds().isEmpty());
    }

    @Test
    @DisplayName("构建后不受 Builder 后续修改影响")
    void testImmutableAfterBuild() {
        AdapterRegistry.Builder builder = AdapterRegistry.builder();
        AdapterRegistry registry = builder.build();
        builder.register(NodeKind.CUBE, MARKER);
        assertFalse(registry.isRegistered(NodeKind.CUBE));
        assertThrows(UnsupportedOperationException.class, () -> registry.registeredKinds().clear());
    }

    @Test
    @DisplayName("toBuilder 派生新表，原表不变")
    void testToBuilder() {
        AdapterRegistry standard = AdapterRegistry.standard();
        NodeAdapter original = standard.lookup(NodeKind.CUBE);
        AdapterRegistry derived = standard.toBuilder().register(NodeKind.CUBE, MARKER).build();

        assertSame(MARKER, derived.lookup(NodeKind.CUBE));
        assertSame(original, standard.lookup(NodeKind.CUBE));
        assertSame(standard.lookup(NodeKind.SPHERE), derived.lookup(NodeKind.SPHERE));
    }

    @Test
    @DisplayName("拒绝 null")
    void testRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> AdapterRegistry.builder().register(null, MARKER));
        assertThrows(IllegalArgumentException.class, () -> AdapterRegistry.builder().register(NodeKind.CUBE, null));
        assertThrows(IllegalArgumentException.class, () -> AdapterRegistry.builder().fallback(null));
    }
}
