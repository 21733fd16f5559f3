package com.argoframe.api.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 事件总线：进程内发布/订阅
 * <p>
 * 处理器按优先级降序执行，同优先级按订阅顺序。
 * 处理器异常只记录日志，永远不会传播给发布方。
 * </p>
 *
 * @author ArgoFrame
 */
public interface EventBus {

    default void subscribe(String eventName, EventHandler handler) {
        subscribe(eventName, handler, EventPriority.NORMAL);
    }

    /**
     * 订阅事件，重复订阅同一个处理器会被调用多次
     */
    void subscribe(String eventName, EventHandler handler, EventPriority priority);

    /**
     * 移除该事件下与 handler 同一实例的所有订阅
     */
    void unsubscribe(String eventName, EventHandler handler);

    default void publishSync(String eventName, Map<String, Object> payload) {
        publishSync(eventName, payload, null);
    }

    default void publishSync(String eventName, Map<String, Object> payload, String source) {
        publishSync(ArgoEvent.of(eventName, payload, source));
    }

    /**
     * 同步发布：记录历史后在当前线程依次调用处理器
     */
    void publishSync(ArgoEvent event);

    default CompletableFuture<Void> publishAsync(String eventName, Map<String, Object> payload) {
        return publishAsync(eventName, payload, null);
    }

    default CompletableFuture<Void> publishAsync(String eventName, Map<String, Object> payload, String source) {
        return publishAsync(ArgoEvent.of(eventName, payload, source));
    }

    /**
     * 异步发布：所有处理器并发执行
     * 返回的 future 在全部处理器结束后完成，且永远不会异常完成
     */
    CompletableFuture<Void> publishAsync(ArgoEvent event);

    default void publish(String eventName, Map<String, Object> payload) {
        publish(eventName, payload, null);
    }

    /**
     * 自动选择：已处于并发派发线程时异步投递（不等待），否则同步执行
     */
    void publish(String eventName, Map<String, Object> payload, String source);

    default List<ArgoEvent> getHistory() {
        return getHistory(null, 10);
    }

    /**
     * 最近的事件，按时间先后排列（最新的在最后）
     *
     * @param eventName 事件名过滤，null 表示全部
     * @param limit     最多返回条数
     */
    List<ArgoEvent> getHistory(String eventName, int limit);

    void clearHistory();

    List<String> listEvents();

    int countHandlers(String eventName);
}
