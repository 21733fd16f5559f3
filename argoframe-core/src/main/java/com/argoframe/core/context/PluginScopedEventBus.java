package com.argoframe.core.context;

import com.argoframe.api.event.ArgoEvent;
import com.argoframe.api.event.EventBus;
import com.argoframe.api.event.EventHandler;
import com.argoframe.api.event.EventPriority;
import com.argoframe.core.event.DefaultEventBus;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 插件视角的事件总线
 * 订阅归属于插件，发布时未指定来源则以插件名作为来源
 */
@RequiredArgsConstructor
class PluginScopedEventBus implements EventBus {

    private final String pluginName;
    private final DefaultEventBus delegate;

    @Override
    public void subscribe(String eventName, EventHandler handler, EventPriority priority) {
        delegate.subscribe(pluginName, eventName, handler, priority);
    }

    @Override
    public void unsubscribe(String eventName, EventHandler handler) {
        delegate.unsubscribe(eventName, handler);
    }

    @Override
    public void publishSync(String eventName, Map<String, Object> payload, String source) {
        delegate.publishSync(eventName, payload, sourceOrSelf(source));
    }

    @Override
    public void publishSync(ArgoEvent event) {
        delegate.publishSync(event);
    }

    @Override
    public CompletableFuture<Void> publishAsync(String eventName, Map<String, Object> payload, String source) {
        return delegate.publishAsync(eventName, payload, sourceOrSelf(source));
    }

    @Override
    public CompletableFuture<Void> publishAsync(ArgoEvent event) {
        return delegate.publishAsync(event);
    }

    @Override
    public void publish(String eventName, Map<String, Object> payload, String source) {
        delegate.publish(eventName, payload, sourceOrSelf(source));
    }

    @Override
    public List<ArgoEvent> getHistory(String eventName, int limit) {
        return delegate.getHistory(eventName, limit);
    }

    @Override
    public void clearHistory() {
        delegate.clearHistory();
    }

    @Override
    public List<String> listEvents() {
        return delegate.listEvents();
    }

    @Override
    public int countHandlers(String eventName) {
        return delegate.countHandlers(eventName);
    }

    private String sourceOrSelf(String source) {
        return source != null ? source : pluginName;
    }
}
