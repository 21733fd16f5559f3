package com.argoframe.core.context;

import com.argoframe.api.hook.AsyncHookCallback;
import com.argoframe.api.hook.HookCallback;
import com.argoframe.api.hook.HookPipeline;
import com.argoframe.core.hook.DefaultHookPipeline;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 插件视角的钩子管道，注册的回调归属于插件
 */
@RequiredArgsConstructor
class PluginScopedHookPipeline implements HookPipeline {

    private final String pluginName;
    private final DefaultHookPipeline delegate;

    @Override
    public <T> void register(String hookPoint, HookCallback<T> callback, int priority) {
        delegate.register(pluginName, hookPoint, callback, priority);
    }

    @Override
    public <T> void registerAsync(String hookPoint, AsyncHookCallback<T> callback, int priority) {
        delegate.registerAsync(pluginName, hookPoint, callback, priority);
    }

    @Override
    public void unregister(String hookPoint, Object callback) {
        delegate.unregister(hookPoint, callback);
    }

    @Override
    public <T> T execute(String hookPoint, T data, Map<String, Object> context) {
        return delegate.execute(hookPoint, data, context);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(String hookPoint, T data, Map<String, Object> context) {
        return delegate.executeAsync(hookPoint, data, context);
    }

    @Override
    public boolean hasHooks(String hookPoint) {
        return delegate.hasHooks(hookPoint);
    }

    @Override
    public int countHooks(String hookPoint) {
        return delegate.countHooks(hookPoint);
    }

    @Override
    public List<String> listHookPoints() {
        return delegate.listHookPoints();
    }

    @Override
    public Map<String, Long> getStats() {
        return delegate.getStats();
    }

    @Override
    public void clearStats() {
        delegate.clearStats();
    }

    @Override
    public void clear(String hookPoint) {
        delegate.clear(hookPoint);
    }
}
