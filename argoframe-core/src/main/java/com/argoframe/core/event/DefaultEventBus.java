package com.argoframe.core.event;

import com.argoframe.api.event.ArgoEvent;
import com.argoframe.api.event.EventBus;
import com.argoframe.api.event.EventHandler;
import com.argoframe.api.event.EventPriority;
import com.argoframe.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 进程内事件总线
 * <p>
 * 特点：
 * - 按优先级降序派发，同优先级保持订阅顺序（稳定排序）
 * - 每个处理器独立隔离，异常只记录日志
 * - 环形历史缓冲，无论有没有处理器都会记录
 * - 处理器可归属某个插件，插件禁用期间跳过
 */
@Slf4j
public class DefaultEventBus implements EventBus, AutoCloseable {

    public static final int DEFAULT_HISTORY_CAPACITY = 100;

    private static final Comparator<HandlerBinding> BY_PRIORITY_DESC =
            Comparator.comparingInt((HandlerBinding b) -> b.priority().level()).reversed();

    // 标记当前线程是否为异步派发线程
    private static final ThreadLocal<Boolean> DISPATCH_THREAD = ThreadLocal.withInitial(() -> false);

    private static final int QUEUE_CAPACITY = 1000;
    private static final long CLOSE_TIMEOUT_SECONDS = 5L;

    private final Map<String, List<HandlerBinding>> handlers = new LinkedHashMap<>();
    private final Deque<ArgoEvent> history = new ArrayDeque<>();
    private final int historyCapacity;

    // 归属判断：返回 false 的 owner 其处理器会被跳过
    private final Predicate<String> ownerFilter;

    // 保护 handlers 与 history
    private final ReentrantLock lock = new ReentrantLock();

    private final ExecutorService dispatchExecutor;

    public DefaultEventBus() {
        this(DEFAULT_HISTORY_CAPACITY, 2, owner -> true);
    }

    public DefaultEventBus(int historyCapacity, int asyncPoolSize, Predicate<String> ownerFilter) {
        if (historyCapacity <= 0) {
            throw new InvalidArgumentException("historyCapacity", "History capacity must be positive");
        }
        if (asyncPoolSize <= 0) {
            throw new InvalidArgumentException("asyncPoolSize", "Async pool size must be positive");
        }
        this.historyCapacity = historyCapacity;
        this.ownerFilter = ownerFilter != null ? ownerFilter : owner -> true;

        AtomicInteger threadNumber = new AtomicInteger(1);
        this.dispatchExecutor = new ThreadPoolExecutor(
                asyncPoolSize,
                asyncPoolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY), // 有界队列，防止无限积压
                r -> {
                    Thread t = new Thread(() -> {
                        DISPATCH_THREAD.set(true);
                        r.run();
                    });
                    t.setName("argoframe-event-" + threadNumber.getAndIncrement());
                    // 守护线程，不阻止 JVM 退出
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((thread, e) ->
                            log.error("Uncaught exception in {}: {}", thread.getName(), e.getMessage(), e));
                    return t;
                },
                // 满载时由发布线程自己执行；关闭后拒绝，由 publishAsync 改为同步派发
                (task, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Event dispatcher is shut down");
                    }
                    task.run();
                }
        );
    }

    // ==================== 订阅 ====================

    @Override
    public void subscribe(String eventName, EventHandler handler, EventPriority priority) {
        subscribe(null, eventName, handler, priority);
    }

    /**
     * 带归属的订阅，由插件上下文调用
     *
     * @param owner 插件名，null 表示宿主
     */
    public void subscribe(String owner, String eventName, EventHandler handler, EventPriority priority) {
        checkEventName(eventName);
        if (handler == null) {
            throw new InvalidArgumentException("handler", "Event handler cannot be null");
        }
        EventPriority effective = priority != null ? priority : EventPriority.NORMAL;

        lock.lock();
        try {
            List<HandlerBinding> bindings = handlers.computeIfAbsent(eventName, k -> new ArrayList<>());
            bindings.add(new HandlerBinding(handler, effective, owner));
            // List.sort 是稳定排序，同优先级保持订阅顺序
            bindings.sort(BY_PRIORITY_DESC);
        } finally {
            lock.unlock();
        }
        log.debug("Event handler registered: {} -> {} (priority={}, owner={})",
                eventName, describe(handler), effective, owner);
    }

    @Override
    public void unsubscribe(String eventName, EventHandler handler) {
        checkEventName(eventName);
        int removed = 0;
        lock.lock();
        try {
            List<HandlerBinding> bindings = handlers.get(eventName);
            if (bindings != null) {
                int before = bindings.size();
                bindings.removeIf(b -> b.handler() == handler);
                removed = before - bindings.size();
                if (bindings.isEmpty()) {
                    handlers.remove(eventName);
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Event handler removed: {} -> {} ({} bindings)", eventName, describe(handler), removed);
        }
    }

    /**
     * 移除某个插件的全部订阅
     *
     * @return 移除的订阅数
     */
    public int unsubscribeAll(String owner) {
        if (owner == null) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, List<HandlerBinding>>> it = handlers.entrySet().iterator();
            while (it.hasNext()) {
                List<HandlerBinding> bindings = it.next().getValue();
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
            log.debug("[{}] Removed {} event subscriptions", owner, removed);
        }
        return removed;
    }

    // ==================== 发布 ====================

    @Override
    public void publishSync(ArgoEvent event) {
        List<HandlerBinding> bindings = recordAndSnapshot(event);
        if (bindings.isEmpty()) {
            log.debug("Event emitted (no handlers): {}", event.getName());
            return;
        }

        log.debug("Event emitted: {} -> {} handlers", event.getName(), bindings.size());
        for (HandlerBinding binding : bindings) {
            if (isActive(binding)) {
                invoke(binding, event);
            }
        }
    }

    @Override
    public CompletableFuture<Void> publishAsync(ArgoEvent event) {
        List<HandlerBinding> bindings = recordAndSnapshot(event);
        if (bindings.isEmpty()) {
            log.debug("Event emitted async (no handlers): {}", event.getName());
            return CompletableFuture.completedFuture(null);
        }

        log.debug("Event emitted async: {} -> {} handlers", event.getName(), bindings.size());
        List<CompletableFuture<Void>> futures = new ArrayList<>(bindings.size());
        for (HandlerBinding binding : bindings) {
            if (!isActive(binding)) {
                continue;
            }
            try {
                futures.add(CompletableFuture
                        .runAsync(() -> invoke(binding, event), dispatchExecutor)
                        .exceptionally(e -> {
                            log.error("Event handler error: {} -> {}: {}",
                                    event.getName(), describe(binding.handler()), e.getMessage(), e);
                            return null;
                        }));
            } catch (RejectedExecutionException e) {
                log.warn("Event bus is closed, dispatching inline: {} -> {}",
                        event.getName(), describe(binding.handler()));
                invoke(binding, event);
            }
        }
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    }

    @Override
    public void publish(String eventName, Map<String, Object> payload, String source) {
        ArgoEvent event = ArgoEvent.of(eventName, payload, source);
        if (isDispatchContext()) {
            // 已处于并发派发线程：异步投递，不等待
            publishAsync(event);
        } else {
            publishSync(event);
        }
    }

    /**
     * 当前线程是否处于并发派发上下文（本总线的派发线程或 ForkJoin 工作线程）
     */
    public static boolean isDispatchContext() {
        return DISPATCH_THREAD.get() || ForkJoinTask.inForkJoinPool();
    }

    // ==================== 历史与查询 ====================

    @Override
    public List<ArgoEvent> getHistory(String eventName, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            List<ArgoEvent> filtered = new ArrayList<>(history.size());
            for (ArgoEvent event : history) {
                if (eventName == null || eventName.equals(event.getName())) {
                    filtered.add(event);
                }
            }
            int from = Math.max(0, filtered.size() - limit);
            return List.copyOf(filtered.subList(from, filtered.size()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearHistory() {
        lock.lock();
        try {
            history.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Event history cleared");
    }

    @Override
    public List<String> listEvents() {
        lock.lock();
        try {
            return List.copyOf(handlers.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int countHandlers(String eventName) {
        lock.lock();
        try {
            List<HandlerBinding> bindings = handlers.get(eventName);
            return bindings != null ? bindings.size() : 0;
        } finally {
            lock.unlock();
        }
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    /**
     * 关闭异步派发线程池，已提交的处理器会执行完毕
     */
    @Override
    public void close() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Event dispatch did not finish in {}s, forcing shutdown", CLOSE_TIMEOUT_SECONDS);
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==================== 内部方法 ====================

    private List<HandlerBinding> recordAndSnapshot(ArgoEvent event) {
        if (event == null) {
            throw new InvalidArgumentException("event", "Event cannot be null");
        }
        checkEventName(event.getName());
        lock.lock();
        try {
            history.addLast(event);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
            List<HandlerBinding> bindings = handlers.get(event.getName());
            return bindings != null ? List.copyOf(bindings) : List.of();
        } finally {
            lock.unlock();
        }
    }

    private void invoke(HandlerBinding binding, ArgoEvent event) {
        try {
            binding.handler().onEvent(event);
        } catch (Exception e) {
            log.error("Event handler error: {} -> {}: {}",
                    event.getName(), describe(binding.handler()), e.getMessage(), e);
        }
    }

    private boolean isActive(HandlerBinding binding) {
        if (binding.owner() == null || ownerFilter.test(binding.owner())) {
            return true;
        }
        log.debug("[{}] Plugin disabled, handler skipped: {}", binding.owner(), describe(binding.handler()));
        return false;
    }

    private static void checkEventName(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw new InvalidArgumentException("eventName", "Event name cannot be null or blank");
        }
    }

    private static String describe(Object handler) {
        return handler.getClass().getName();
    }

    /**
     * 处理器绑定
     */
    private record HandlerBinding(EventHandler handler, EventPriority priority, String owner) {
    }
}
