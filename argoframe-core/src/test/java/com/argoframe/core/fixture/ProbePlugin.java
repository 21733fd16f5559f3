package com.argoframe.core.fixture;

import com.argoframe.api.context.PluginContext;
import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.api.plugin.PluginMetadata;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 可配置行为的测试插件
 */
public class ProbePlugin implements ArgoPlugin {

    private final PluginMetadata metadata;
    private Consumer<PluginContext> onInitialize = context -> { };
    private Runnable onShutdown = () -> { };
    private boolean healthy = true;
    private RuntimeException healthFailure;

    private final AtomicInteger initializeCount = new AtomicInteger();
    private final AtomicInteger shutdownCount = new AtomicInteger();
    private volatile PluginContext context;

    public ProbePlugin(String name) {
        this.metadata = PluginMetadata.builder().name(name).version("1.0.0").build();
    }

    public ProbePlugin onInitialize(Consumer<PluginContext> action) {
        this.onInitialize = action;
        return this;
    }

    public ProbePlugin onShutdown(Runnable action) {
        this.onShutdown = action;
        return this;
    }

    public ProbePlugin healthy(boolean healthy) {
        this.healthy = healthy;
        return this;
    }

    public ProbePlugin failHealthCheck(RuntimeException failure) {
        this.healthFailure = failure;
        return this;
    }

    @Override
    public PluginMetadata getMetadata() {
        return metadata;
    }

    @Override
    public void initialize(PluginContext context) {
        initializeCount.incrementAndGet();
        this.context = context;
        onInitialize.accept(context);
    }

    @Override
    public void shutdown() {
        shutdownCount.incrementAndGet();
        onShutdown.run();
    }

    @Override
    public boolean healthCheck() {
        if (healthFailure != null) {
            throw healthFailure;
        }
        return healthy;
    }

    public int getInitializeCount() {
        return initializeCount.get();
    }

    public int getShutdownCount() {
        return shutdownCount.get();
    }

    public PluginContext getContext() {
        return context;
    }
}
