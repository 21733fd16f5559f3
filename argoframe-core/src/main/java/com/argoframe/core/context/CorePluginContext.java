package com.argoframe.core.context;

import com.argoframe.api.capability.CapabilityRegistry;
import com.argoframe.api.config.PluginManifest;
import com.argoframe.api.context.PluginContext;
import com.argoframe.api.event.EventBus;
import com.argoframe.api.hook.HookPipeline;
import com.argoframe.core.capability.DefaultCapabilityRegistry;
import com.argoframe.core.config.ArgoFrameConfig;
import com.argoframe.core.event.DefaultEventBus;
import com.argoframe.core.hook.DefaultHookPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * 每个插件独享的宿主上下文
 * 能力注册、事件订阅与钩子注册都以插件名作为归属，禁用时跳过，初始化失败或关闭时回收
 */
@Slf4j
public class CorePluginContext implements PluginContext {

    private final String pluginName;
    private final PluginManifest manifest;
    private final ArgoFrameConfig config;
    private final CapabilityRegistry capabilityRegistry;
    private final EventBus eventBus;
    private final HookPipeline hookPipeline;

    public CorePluginContext(String pluginName,
                             PluginManifest manifest,
                             ArgoFrameConfig config,
                             DefaultCapabilityRegistry capabilityRegistry,
                             DefaultEventBus eventBus,
                             DefaultHookPipeline hookPipeline) {
        this.pluginName = pluginName;
        this.manifest = manifest;
        this.config = config;
        this.capabilityRegistry = new PluginScopedCapabilityRegistry(pluginName, capabilityRegistry);
        this.eventBus = new PluginScopedEventBus(pluginName, eventBus);
        this.hookPipeline = new PluginScopedHookPipeline(pluginName, hookPipeline);
    }

    @Override
    public String getPluginName() {
        return pluginName;
    }

    @Override
    public Optional<String> getProperty(String key) {
        if (key == null) {
            return Optional.empty();
        }
        // 1. 插件清单
        if (manifest != null && manifest.getProperties() != null) {
            Object value = lookup(manifest.getProperties(), key);
            if (value != null) {
                return Optional.of(String.valueOf(value));
            }
        }
        // 2. 宿主配置
        Optional<String> hostValue = config.getProperty(key);
        if (hostValue.isPresent()) {
            return hostValue;
        }
        // 3. JVM 系统属性
        return Optional.ofNullable(System.getProperty(key));
    }

    @Override
    public CapabilityRegistry getCapabilityRegistry() {
        return capabilityRegistry;
    }

    @Override
    public EventBus getEventBus() {
        return eventBus;
    }

    @Override
    public HookPipeline getHookPipeline() {
        return hookPipeline;
    }

    /**
     * 先按完整 key 查找，找不到再按点分路径逐级进入嵌套 Map
     */
    private static Object lookup(Map<String, Object> properties, String key) {
        Object direct = properties.get(key);
        if (direct != null) {
            return direct;
        }
        Object current = properties;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current instanceof Map ? null : current;
    }
}
