package com.argoframe.api.plugin;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Singular;

import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 插件元数据
 * <p>
 * 除 {@code enabled} 与 {@code loadedAt} 外均不可变，
 * 这两个字段由 PluginManager 维护。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
public class PluginMetadata {

    // === 基础元数据 ===
    private final String name;
    private final String version;
    @Builder.Default
    private final String author = "ARGO Team";
    @Builder.Default
    private final String description = "";

    // 声明的能力标签
    @Singular
    private final Set<PluginCapability> capabilities;

    // 依赖的插件名，仅作展示，不参与加载排序
    @Singular
    private final Set<String> dependencies;

    // === 运行时状态 ===
    @Setter
    @Builder.Default
    private volatile boolean enabled = true;

    @Setter
    private volatile Instant loadedAt;

    /**
     * 拷贝，对外暴露快照时使用
     */
    public PluginMetadata copy() {
        return toBuilder().build();
    }

    @Override
    public String toString() {
        String caps = capabilities.stream()
                .map(PluginCapability::value)
                .collect(Collectors.joining(", "));
        return String.format("PluginMetadata{name='%s', version='%s', capabilities=[%s], enabled=%s}",
                name, version, caps, enabled);
    }
}
