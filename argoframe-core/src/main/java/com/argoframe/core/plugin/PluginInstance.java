package com.argoframe.core.plugin;

import com.argoframe.api.config.PluginManifest;
import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.api.plugin.PluginMetadata;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 插件实例：一个已注册插件的运行实体
 * 包含：插件对象 + 元数据 + 清单 + 来源单元 + 生命周期状态
 */
@Getter
public class PluginInstance {

    private final ArgoPlugin plugin;

    private final PluginMetadata metadata;

    // 没有 plugin.yml 时为空清单
    private final PluginManifest manifest;

    // 来源单元，编程方式注册时为 null
    private final Path source;

    private volatile PluginState state = PluginState.INSTANTIATED;

    public PluginInstance(ArgoPlugin plugin, PluginMetadata metadata, PluginManifest manifest, Path source) {
        this.plugin = plugin;
        this.metadata = metadata;
        this.manifest = manifest != null ? manifest : new PluginManifest();
        this.source = source;
    }

    public String getName() {
        return metadata.getName();
    }

    void transitionTo(PluginState next) {
        this.state = next;
    }

    /**
     * 启用且处于 ACTIVE 状态
     */
    public boolean isActive() {
        return state == PluginState.ACTIVE && metadata.isEnabled();
    }
}
