package com.argoframe.core.hook;

import com.argoframe.api.exception.InvalidArgumentException;
import com.argoframe.api.hook.AsyncHookCallback;
import com.argoframe.api.hook.HookCallback;
import com.argoframe.api.hook.HookPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 钩子管道默认实现
 * <p>
 * 每个钩子点维护一条按优先级降序排列的回调链，执行时在快照上串行推进数据。
 * 单个回调失败只记录日志，数据保持失败前的值继续向下传递。
 * </p>
 */
@Slf4j
public class DefaultHookPipeline implements HookPipeline {

    private static final Comparator<HookBinding> BY_PRIORITY_DESC =
            Comparator.comparingInt(HookBinding::priority).reversed();

    private final Map<String, List<HookBinding>> hooks = new LinkedHashMap<>();
    private final Map<String, Long> stats = new LinkedHashMap<>();
    private final Predicate<String> ownerFilter;

    // 保护 hooks 与 stats
    private final ReentrantLock lock = new ReentrantLock();

    public DefaultHookPipeline() {
        this(owner -> true);
    }

    public DefaultHookPipeline(Predicate<String> ownerFilter) {
        this.ownerFilter = ownerFilter != null ? ownerFilter : owner -> true;
    }

    // ==================== 注册 ====================

    @Override
    public <T> void register(String hookPoint, HookCallback<T> callback, int priority) {
        register(null, hookPoint, callback, priority);
    }

    /**
     * 带归属的同步回调注册
     *
     * @param owner 插件名，null 表示宿主
     */
    public <T> void register(String owner, String hookPoint, HookCallback<T> callback, int priority) {
        bind(owner, hookPoint, callback, false, priority);
    }

    @Override
    public <T> void registerAsync(String hookPoint, AsyncHookCallback<T> callback, int priority) {
        registerAsync(null, hookPoint, callback, priority);
    }

    public <T> void registerAsync(String owner, String hookPoint, AsyncHookCallback<T> callback, int priority) {
        bind(owner, hookPoint, callback, true, priority);
    }

    @Override
    public void unregister(String hookPoint, Object callback) {
        checkHookPoint(hookPoint);
        int removed = 0;
        lock.lock();
        try {
            List<HookBinding> bindings = hooks.get(hookPoint);
            if (bindings != null) {
                int before = bindings.size();
                bindings.removeIf(b -> b.callback() == callback);
                removed = before - bindings.size();
                if (bindings.isEmpty()) {
                    hooks.remove(hookPoint);
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Hook callback removed: {} -> {}", hookPoint, describe(callback));
        }
    }

    /**
     * 移除某个插件注册的全部回调
     *
     * @return 移除的回调数
     */
    public int unregisterAll(String owner) {
        if (owner == null) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, List<HookBinding>>> it = hooks.entrySet().iterator();
            while (it.hasNext()) {
                List<HookBinding> bindings = it.next().getValue();
                int before = bindings.size();
                bindings.removeIf(b -> owner.equals(b.owner()));
                removed += before - bindings.size();
                if (bindings.isEmpty()) {
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("[{}] Removed {} hook callbacks", owner, removed);
        }
        return removed;
    }

    // ==================== 执行 ====================

    @Override
    public <T> T execute(String hookPoint, T data, Map<String, Object> context) {
        List<HookBinding> bindings = snapshotAndCount(hookPoint);
        if (bindings.isEmpty()) {
            return data;
        }

        Map<String, Object> ctx = context != null ? context : new HashMap<>();
        T current = data;
        for (HookBinding binding : bindings) {
            if (isActive(binding)) {
                current = applyInline(hookPoint, binding, current, ctx);
            }
        }
        return current;
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(String hookPoint, T data, Map<String, Object> context) {
        List<HookBinding> bindings = snapshotAndCount(hookPoint);
        if (bindings.isEmpty()) {
            return CompletableFuture.completedFuture(data);
        }

        Map<String, Object> ctx = context != null ? context : new HashMap<>();
        CompletableFuture<T> chain = CompletableFuture.completedFuture(data);
        for (HookBinding binding : bindings) {
            // 严格串行：上一步完成后才调用下一个回调
            chain = chain.thenCompose(current -> isActive(binding)
                    ? applyChained(hookPoint, binding, current, ctx)
                    : CompletableFuture.completedFuture(current));
        }
        return chain;
    }

    // ==================== 查询 ====================

    @Override
    public boolean hasHooks(String hookPoint) {
        return countHooks(hookPoint) > 0;
    }

    @Override
    public int countHooks(String hookPoint) {
        lock.lock();
        try {
            List<HookBinding> bindings = hooks.get(hookPoint);
            return bindings != null ? bindings.size() : 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> listHookPoints() {
        lock.lock();
        try {
            return List.copyOf(hooks.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Long> getStats() {
        lock.lock();
        try {
            return Map.copyOf(stats);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearStats() {
        lock.lock();
        try {
            stats.replaceAll((k, v) -> 0L);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear(String hookPoint) {
        lock.lock();
        try {
            if (hookPoint == null) {
                hooks.clear();
            } else {
                hooks.remove(hookPoint);
            }
        } finally {
            lock.unlock();
        }
        log.debug("Hooks cleared: {}", hookPoint != null ? hookPoint : "<all>");
    }

    // ==================== 内部方法 ====================

    private void bind(String owner, String hookPoint, Object callback, boolean async, int priority) {
        checkHookPoint(hookPoint);
        if (callback == null) {
            throw new InvalidArgumentException("callback", "Hook callback cannot be null");
        }
        lock.lock();
        try {
            List<HookBinding> bindings = hooks.computeIfAbsent(hookPoint, k -> new ArrayList<>());
            bindings.add(new HookBinding(callback, async, priority, owner));
            bindings.sort(BY_PRIORITY_DESC);
            stats.putIfAbsent(hookPoint, 0L);
        } finally {
            lock.unlock();
        }
        log.debug("Hook registered: {} -> {} (priority={}, async={}, owner={})",
                hookPoint, describe(callback), priority, async, owner);
    }

    private List<HookBinding> snapshotAndCount(String hookPoint) {
        checkHookPoint(hookPoint);
        lock.lock();
        try {
            List<HookBinding> bindings = hooks.get(hookPoint);
            if (bindings == null || bindings.isEmpty()) {
                return List.of();
            }
            stats.merge(hookPoint, 1L, Long::sum);
            return List.copyOf(bindings);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在当前线程执行一个回调，异步回调会被等待
     */
    @SuppressWarnings("unchecked")
    private <T> T applyInline(String hookPoint, HookBinding binding, T current, Map<String, Object> ctx) {
        try {
            T result;
            if (binding.async()) {
                CompletionStage<T> stage = ((AsyncHookCallback<T>) binding.callback()).applyAsync(current, ctx);
                result = stage != null ? stage.toCompletableFuture().join() : null;
            } else {
                result = ((HookCallback<T>) binding.callback()).apply(current, ctx);
            }
            return result != null ? result : current;
        } catch (Exception e) {
            logFailure(hookPoint, binding, e);
            return current;
        }
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> applyChained(String hookPoint, HookBinding binding, T current,
                                                  Map<String, Object> ctx) {
        if (!binding.async()) {
            return CompletableFuture.completedFuture(applyInline(hookPoint, binding, current, ctx));
        }
        CompletionStage<T> stage;
        try {
            stage = ((AsyncHookCallback<T>) binding.callback()).applyAsync(current, ctx);
        } catch (Exception e) {
            logFailure(hookPoint, binding, e);
            return CompletableFuture.completedFuture(current);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(current);
        }
        return stage.toCompletableFuture().handle((result, e) -> {
            if (e != null) {
                logFailure(hookPoint, binding, e);
                return current;
            }
            return result != null ? result : current;
        });
    }

    private boolean isActive(HookBinding binding) {
        if (binding.owner() == null || ownerFilter.test(binding.owner())) {
            return true;
        }
        log.debug("[{}] Plugin disabled, hook skipped: {}", binding.owner(), describe(binding.callback()));
        return false;
    }

    private void logFailure(String hookPoint, HookBinding binding, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null
                ? e.getCause() : e;
        log.error("Hook callback error at {}: {} -> {}",
                hookPoint, describe(binding.callback()), cause.getMessage(), cause);
    }

    private static void checkHookPoint(String hookPoint) {
        if (hookPoint == null || hookPoint.isBlank()) {
            throw new InvalidArgumentException("hookPoint", "Hook point cannot be null or blank");
        }
    }

    private static String describe(Object callback) {
        return callback.getClass().getName();
    }

    /**
     * 回调绑定，callback 为 {@link HookCallback} 或 {@link AsyncHookCallback}
     */
    private record HookBinding(Object callback, boolean async, int priority, String owner) {
    }
}
