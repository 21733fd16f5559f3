package com.argoframe.api.hook;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 钩子管道
 * <p>
 * 与事件总线的区别：钩子是串行的数据变换链，前一个回调的输出是后一个回调的输入，
 * 顺序决定结果；事件是互不相关的广播。
 * </p>
 * 回调按优先级降序执行，同优先级按注册顺序。
 *
 * @author ArgoFrame
 */
public interface HookPipeline {

    default <T> void register(String hookPoint, HookCallback<T> callback) {
        register(hookPoint, callback, 0);
    }

    <T> void register(String hookPoint, HookCallback<T> callback, int priority);

    default <T> void register(HookPoint hookPoint, HookCallback<T> callback) {
        register(hookPoint.key(), callback, 0);
    }

    default <T> void register(HookPoint hookPoint, HookCallback<T> callback, int priority) {
        register(hookPoint.key(), callback, priority);
    }

    <T> void registerAsync(String hookPoint, AsyncHookCallback<T> callback, int priority);

    default <T> void registerAsync(HookPoint hookPoint, AsyncHookCallback<T> callback, int priority) {
        registerAsync(hookPoint.key(), callback, priority);
    }

    /**
     * 移除该钩子点下与 callback 同一实例的所有注册（同步或异步回调均可）
     */
    void unregister(String hookPoint, Object callback);

    default void unregister(HookPoint hookPoint, Object callback) {
        unregister(hookPoint.key(), callback);
    }

    default <T> T execute(String hookPoint, T data) {
        return execute(hookPoint, data, null);
    }

    /**
     * 同步执行钩子链
     * 没有任何回调时原样返回 data
     */
    <T> T execute(String hookPoint, T data, Map<String, Object> context);

    default <T> T execute(HookPoint hookPoint, T data) {
        return execute(hookPoint.key(), data, null);
    }

    default <T> T execute(HookPoint hookPoint, T data, Map<String, Object> context) {
        return execute(hookPoint.key(), data, context);
    }

    default <T> CompletableFuture<T> executeAsync(String hookPoint, T data) {
        return executeAsync(hookPoint, data, null);
    }

    /**
     * 异步执行钩子链，依然严格串行
     */
    <T> CompletableFuture<T> executeAsync(String hookPoint, T data, Map<String, Object> context);

    default <T> CompletableFuture<T> executeAsync(HookPoint hookPoint, T data, Map<String, Object> context) {
        return executeAsync(hookPoint.key(), data, context);
    }

    boolean hasHooks(String hookPoint);

    int countHooks(String hookPoint);

    List<String> listHookPoints();

    /**
     * 各钩子点的执行次数快照
     */
    Map<String, Long> getStats();

    void clearStats();

    /**
     * 清空指定钩子点的回调，null 表示全部
     */
    void clear(String hookPoint);
}
