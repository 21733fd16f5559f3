package com.argoframe.api.hook;

import java.util.Map;

/**
 * 同步钩子回调
 * <p>
 * 返回非 null 时替换当前数据；返回 null 表示原地修改或不修改。
 * 抛出的异常会被管道记录并跳过，数据保持调用前的值。
 * </p>
 *
 * @param <T> 数据类型
 */
@FunctionalInterface
public interface HookCallback<T> {

    T apply(T data, Map<String, Object> context) throws Exception;
}
