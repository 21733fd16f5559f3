package com.argoframe.api.hook;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * 异步钩子回调
 * 管道会等待其完成后再调用下一个回调，语义与 {@link HookCallback} 相同
 *
 * @param <T> 数据类型
 */
@FunctionalInterface
public interface AsyncHookCallback<T> {

    CompletionStage<T> applyAsync(T data, Map<String, Object> context) throws Exception;
}
