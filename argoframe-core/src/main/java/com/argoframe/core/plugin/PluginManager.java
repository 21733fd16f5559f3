package com.argoframe.core.plugin;

import com.argoframe.api.capability.Analyzer;
import com.argoframe.api.capability.CapabilityRegistry;
import com.argoframe.api.capability.Evaluator;
import com.argoframe.api.capability.Extractor;
import com.argoframe.api.capability.IntelligenceEnhancer;
import com.argoframe.api.config.PluginManifest;
import com.argoframe.api.event.EventBus;
import com.argoframe.api.event.SystemEvents;
import com.argoframe.api.exception.InvalidArgumentException;
import com.argoframe.api.hook.HookPipeline;
import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.api.plugin.PluginMetadata;
import com.argoframe.core.capability.DefaultCapabilityRegistry;
import com.argoframe.core.classloader.DefaultPluginLoaderFactory;
import com.argoframe.core.config.ArgoFrameConfig;
import com.argoframe.core.context.CorePluginContext;
import com.argoframe.core.event.DefaultEventBus;
import com.argoframe.core.hook.DefaultHookPipeline;
import com.argoframe.core.loader.PluginDiscoveryService;
import com.argoframe.core.spi.PluginLoaderFactory;
import jakarta.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件生命周期管理器
 * 职责：
 * 1. 插件的发现与注册 (Discover/Register)
 * 2. 插件的启用与禁用 (Enable/Disable)
 * 3. 健康检查与全局关闭 (Health/Shutdown)
 * 4. 能力查找的门面 (Analyzer/Extractor/Evaluator/Enhancer)
 */
@Slf4j
public class PluginManager implements AutoCloseable {

    private final ArgoFrameConfig config;

    private final DefaultCapabilityRegistry capabilityRegistry;
    private final DefaultEventBus eventBus;
    private final DefaultHookPipeline hookPipeline;
    private final PluginDiscoveryService discoveryService;

    // 插件表：Key=插件名，保留注册顺序
    private final Map<String, PluginInstance> plugins = new LinkedHashMap<>();

    // 正在初始化的插件名，防止并发注册同名插件
    private final Set<String> pendingNames = new HashSet<>();

    // 被禁用的插件名，事件总线与钩子管道据此跳过其绑定
    private final Set<String> disabledOwners = ConcurrentHashMap.newKeySet();

    // 保护 plugins 与 pendingNames，插件回调期间不持有
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean closed = false;

    public PluginManager() {
        this(ArgoFrameConfig.defaults());
    }

    public PluginManager(ArgoFrameConfig config) {
        this(config, new DefaultPluginLoaderFactory());
    }

    public PluginManager(ArgoFrameConfig config, PluginLoaderFactory loaderFactory) {
        this.config = config != null ? config : ArgoFrameConfig.defaults();
        this.capabilityRegistry = new DefaultCapabilityRegistry();
        this.eventBus = new DefaultEventBus(
                this.config.getEventHistoryCapacity(),
                this.config.getAsyncPoolSize(),
                this::isOwnerEnabled);
        this.hookPipeline = new DefaultHookPipeline(this::isOwnerEnabled);
        this.discoveryService = new PluginDiscoveryService(this.config, this, loaderFactory);
    }

    // ==================== 发现 ====================

    /**
     * 按配置自动扫描插件目录
     *
     * @return 注册的插件数，autoScan 关闭时为 0
     */
    public int start() {
        if (!config.isAutoScan()) {
            log.info("AutoScan disabled, skipping plugin discovery");
            return 0;
        }
        return loadFromDirectory(Paths.get(config.getPluginHome()), config.getPluginPattern());
    }

    public int loadFromDirectory(Path dir) {
        return loadFromDirectory(dir, config.getPluginPattern());
    }

    public int loadFromDirectory(Path dir, String pattern) {
        checkOpen();
        return discoveryService.discover(dir, pattern);
    }

    // ==================== 注册 ====================

    public boolean registerPlugin(ArgoPlugin plugin) {
        return registerPlugin(plugin, null, null);
    }

    public boolean registerPlugin(ArgoPlugin plugin, PluginManifest manifest) {
        return registerPlugin(plugin, manifest, null);
    }

    /**
     * 注册并初始化插件
     *
     * @param plugin   插件实例
     * @param manifest 来源单元的清单，可为 null
     * @param source   来源单元，编程方式注册时为 null
     * @return 是否注册成功；重名或初始化失败时返回 false
     */
    public boolean registerPlugin(ArgoPlugin plugin, PluginManifest manifest, Path source) {
        if (plugin == null) {
            throw new InvalidArgumentException("plugin", "Plugin cannot be null");
        }
        checkOpen();

        PluginMetadata metadata;
        try {
            metadata = plugin.getMetadata();
        } catch (Exception e) {
            log.error("Failed to read metadata of {}", plugin.getClass().getName(), e);
            return false;
        }
        if (metadata == null || metadata.getName() == null || metadata.getName().isBlank()) {
            log.error("Plugin {} has no name, skipped", plugin.getClass().getName());
            return false;
        }
        String name = metadata.getName();

        // 1. 占位，重名直接拒绝，不调用 initialize
        lock.lock();
        try {
            if (plugins.containsKey(name) || !pendingNames.add(name)) {
                log.warn("Plugin {} already registered, ignoring {}", name, plugin.getClass().getName());
                return false;
            }
        } finally {
            lock.unlock();
        }

        PluginInstance instance = new PluginInstance(plugin, metadata, manifest, source);
        try {
            // 2. 初始化（不持锁，插件可能回调注册表、事件总线）
            CorePluginContext context = new CorePluginContext(
                    name, instance.getManifest(), config, capabilityRegistry, eventBus, hookPipeline);
            plugin.initialize(context);
            instance.transitionTo(PluginState.INITIALIZED);
        } catch (Exception | LinkageError e) {
            log.error("[{}] Failed to initialize plugin", name, e);
            revokeBindings(name);
            lock.lock();
            try {
                pendingNames.remove(name);
            } finally {
                lock.unlock();
            }
            return false;
        }

        // 3. 入表并激活
        metadata.setLoadedAt(Instant.now());
        metadata.setEnabled(true);
        disabledOwners.remove(name);
        lock.lock();
        try {
            plugins.put(name, instance);
            pendingNames.remove(name);
            instance.transitionTo(PluginState.ACTIVE);
        } finally {
            lock.unlock();
        }

        log.info("Plugin loaded: {} v{}", name, metadata.getVersion());
        eventBus.publish(SystemEvents.PLUGIN_LOADED, pluginPayload(metadata), SystemEvents.RUNTIME_SOURCE);
        return true;
    }

    // ==================== 启用 / 禁用 ====================

    /**
     * 启用插件，恢复其事件订阅与钩子回调
     *
     * @return 插件存在且未关闭时返回 true
     */
    public boolean enablePlugin(String name) {
        PluginInstance instance = findInstance(name);
        if (instance == null) {
            log.warn("Plugin not found: {}", name);
            return false;
        }
        if (!instance.getState().isRunning()) {
            log.warn("[{}] Plugin is {}, cannot enable", name, instance.getState());
            return false;
        }
        instance.getMetadata().setEnabled(true);
        instance.transitionTo(PluginState.ACTIVE);
        disabledOwners.remove(name);

        log.info("[{}] Plugin enabled", name);
        eventBus.publish(SystemEvents.PLUGIN_ENABLED, pluginPayload(instance.getMetadata()), SystemEvents.RUNTIME_SOURCE);
        return true;
    }

    /**
     * 禁用插件，其事件订阅与钩子回调被跳过但不删除
     *
     * @return 插件存在且未关闭时返回 true
     */
    public boolean disablePlugin(String name) {
        PluginInstance instance = findInstance(name);
        if (instance == null) {
            log.warn("Plugin not found: {}", name);
            return false;
        }
        if (!instance.getState().isRunning()) {
            log.warn("[{}] Plugin is {}, cannot disable", name, instance.getState());
            return false;
        }
        instance.getMetadata().setEnabled(false);
        instance.transitionTo(PluginState.DISABLED);
        disabledOwners.add(name);

        log.info("[{}] Plugin disabled", name);
        eventBus.publish(SystemEvents.PLUGIN_DISABLED, pluginPayload(instance.getMetadata()), SystemEvents.RUNTIME_SOURCE);
        return true;
    }

    // ==================== 健康检查 / 关闭 ====================

    /**
     * 探测所有 ACTIVE 插件，抛异常记为 false
     */
    public Map<String, Boolean> healthCheck() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (PluginInstance instance : snapshot()) {
            if (!instance.isActive()) {
                continue;
            }
            boolean healthy;
            try {
                healthy = instance.getPlugin().healthCheck();
            } catch (Exception e) {
                log.error("[{}] Health check failed", instance.getName(), e);
                healthy = false;
            }
            results.put(instance.getName(), healthy);
        }
        return results;
    }

    /**
     * 关闭所有插件，单个插件失败不影响其余插件
     *
     * @return 本次关闭的插件数
     */
    public int shutdownAll() {
        log.info("Shutting down all plugins...");
        int count = 0;
        for (PluginInstance instance : snapshot()) {
            if (instance.getState() == PluginState.SHUTDOWN) {
                continue;
            }
            String name = instance.getName();
            try {
                instance.getPlugin().shutdown();
                log.info("[{}] Plugin shut down", name);
            } catch (Exception e) {
                log.error("[{}] Error shutting down plugin", name, e);
            }
            revokeBindings(name);
            instance.transitionTo(PluginState.SHUTDOWN);
            count++;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("count", count);
        eventBus.publish(SystemEvents.PLUGINS_SHUTDOWN, payload, SystemEvents.RUNTIME_SOURCE);
        log.info("Plugin shutdown complete: {} plugin(s)", count);
        return count;
    }

    /**
     * 关闭所有插件并释放线程池与类加载器
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        shutdownAll();
        closed = true;
        eventBus.close();
        discoveryService.close();
        log.info("PluginManager closed");
    }

    // ==================== 能力查找 ====================

    public Optional<Analyzer> getAnalyzerFor(Path path) {
        return capabilityRegistry.findAnalyzer(path);
    }

    public Optional<Extractor> getExtractorFor(Path path) {
        return capabilityRegistry.findExtractor(path);
    }

    public Optional<Evaluator> getEvaluator(String name) {
        return capabilityRegistry.findEvaluator(name);
    }

    public Optional<IntelligenceEnhancer> getIntelligencePlugin(String capability) {
        return capabilityRegistry.findEnhancer(capability);
    }

    public List<Analyzer> listAnalyzers() {
        return capabilityRegistry.listAnalyzers();
    }

    // ==================== 查询 ====================

    /**
     * 所有插件元数据的快照，按注册顺序
     */
    public List<PluginMetadata> listPlugins() {
        List<PluginMetadata> result = new ArrayList<>();
        for (PluginInstance instance : snapshot()) {
            result.add(instance.getMetadata().copy());
        }
        return result;
    }

    public Optional<ArgoPlugin> getPlugin(String name) {
        return Optional.ofNullable(findInstance(name)).map(PluginInstance::getPlugin);
    }

    public Optional<PluginState> getPluginState(String name) {
        return Optional.ofNullable(findInstance(name)).map(PluginInstance::getState);
    }

    public CapabilityRegistry getCapabilityRegistry() {
        return capabilityRegistry;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public HookPipeline getHookPipeline() {
        return hookPipeline;
    }

    public ArgoFrameConfig getConfig() {
        return config;
    }

    public ManagerStats getStats() {
        int active = 0;
        int disabled = 0;
        int shutdown = 0;
        List<PluginInstance> all = snapshot();
        for (PluginInstance instance : all) {
            switch (instance.getState()) {
                case ACTIVE -> active++;
                case DISABLED -> disabled++;
                case SHUTDOWN -> shutdown++;
                default -> {
                }
            }
        }
        return new ManagerStats(all.size(), active, disabled, shutdown, discoveryService.getActiveLoaderCount());
    }

    // ==================== 内部方法 ====================

    private boolean isOwnerEnabled(String owner) {
        return !disabledOwners.contains(owner);
    }

    private void revokeBindings(String name) {
        int capabilities = capabilityRegistry.unregisterAll(name);
        int handlers = eventBus.unsubscribeAll(name);
        int hooks = hookPipeline.unregisterAll(name);
        disabledOwners.remove(name);
        if (capabilities > 0 || handlers > 0 || hooks > 0) {
            log.debug("[{}] Revoked {} capability(ies), {} event handler(s), {} hook callback(s)",
                    name, capabilities, handlers, hooks);
        }
    }

    private PluginInstance findInstance(String name) {
        if (name == null) {
            return null;
        }
        lock.lock();
        try {
            return plugins.get(name);
        } finally {
            lock.unlock();
        }
    }

    private List<PluginInstance> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(plugins.values());
        } finally {
            lock.unlock();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("PluginManager is closed");
        }
    }

    private static Map<String, Object> pluginPayload(PluginMetadata metadata) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("plugin", metadata.getName());
        payload.put("version", metadata.getVersion());
        return payload;
    }

    /**
     * 管理器统计信息
     */
    public record ManagerStats(int total, int active, int disabled, int shutdown, int classLoaders) {
        @Override
        @Nonnull
        public String toString() {
            return String.format("ManagerStats{total=%d, active=%d, disabled=%d, shutdown=%d, classLoaders=%d}",
                    total, active, disabled, shutdown, classLoaders);
        }
    }
}
