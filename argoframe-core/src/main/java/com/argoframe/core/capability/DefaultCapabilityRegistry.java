package com.argoframe.core.capability;

import com.argoframe.api.capability.Capability;
import com.argoframe.api.capability.CapabilityKind;
import com.argoframe.api.capability.CapabilityRegistry;
import com.argoframe.api.capability.FileCapability;
import com.argoframe.api.capability.IntelligenceEnhancer;
import com.argoframe.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 能力注册表
 * 职责：按种类维护 名称 -> 能力 的有序映射，提供按文件扩展名和按名称的查找。
 * 每条注册记录归属插件名，插件初始化失败或关闭时据此回收。
 */
@Slf4j
public class DefaultCapabilityRegistry implements CapabilityRegistry {

    // 种类 -> (名称 -> 能力)，LinkedHashMap 保留注册顺序
    private final Map<CapabilityKind, Map<String, CapabilityBinding>> capabilities = new EnumMap<>(CapabilityKind.class);

    private final ReentrantLock lock = new ReentrantLock();

    public DefaultCapabilityRegistry() {
        for (CapabilityKind kind : CapabilityKind.values()) {
            capabilities.put(kind, new LinkedHashMap<>());
        }
    }

    @Override
    public boolean register(CapabilityKind kind, Capability capability) {
        return register(null, kind, capability);
    }

    /**
     * 带归属的注册，由插件上下文调用
     *
     * @param owner 插件名，null 表示宿主
     */
    public boolean register(String owner, CapabilityKind kind, Capability capability) {
        if (kind == null) {
            throw new InvalidArgumentException("kind", "Capability kind cannot be null");
        }
        if (capability == null) {
            throw new InvalidArgumentException("capability", "Capability cannot be null");
        }
        if (!kind.type().isInstance(capability)) {
            throw new InvalidArgumentException("capability",
                    capability.getClass().getName() + " does not implement " + kind.type().getSimpleName());
        }
        String name = capability.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Capability name cannot be null or blank");
        }

        lock.lock();
        try {
            Map<String, CapabilityBinding> byName = capabilities.get(kind);
            CapabilityBinding binding = byName.get(name);
            if (binding != null) {
                Capability existing = binding.capability();
                if (kind != CapabilityKind.ANALYZER) {
                    log.warn("{} '{}' already registered by {}, ignoring {}",
                            kind, name, existing.getClass().getName(), capability.getClass().getName());
                    return false;
                }
                // 分析器允许覆盖（热替换），保留原位置
                log.warn("Analyzer '{}' replaced: {} -> {}",
                        name, existing.getClass().getName(), capability.getClass().getName());
            }
            byName.put(name, new CapabilityBinding(capability, owner));
        } finally {
            lock.unlock();
        }
        log.info("Registered {}: {} (owner={})", kind, name, owner);
        return true;
    }

    @Override
    public Optional<Capability> lookupForFile(CapabilityKind kind, Path path) {
        if (kind == null || path == null || !kind.isFileBased()) {
            return Optional.empty();
        }
        for (Capability capability : list(kind)) {
            if (handles((FileCapability) capability, path)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Capability> lookupByName(CapabilityKind kind, String name) {
        if (kind == null || name == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(capabilities.get(kind).get(name)).map(CapabilityBinding::capability);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Capability> list(CapabilityKind kind) {
        if (kind == null) {
            return List.of();
        }
        lock.lock();
        try {
            return capabilities.get(kind).values().stream()
                    .map(CapabilityBinding::capability)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<IntelligenceEnhancer> findEnhancer(String capability) {
        if (capability == null) {
            return Optional.empty();
        }
        return list(CapabilityKind.INTELLIGENCE_ENHANCER).stream()
                .map(IntelligenceEnhancer.class::cast)
                .filter(enhancer -> capability.equals(enhancer.getCapability()))
                .findFirst();
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            capabilities.values().forEach(Map::clear);
        } finally {
            lock.unlock();
        }
        log.debug("Capability registry cleared");
    }

    /**
     * 移除某个插件注册的全部能力
     *
     * @return 移除的能力数
     */
    public int unregisterAll(String owner) {
        if (owner == null) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            for (Map<String, CapabilityBinding> byName : capabilities.values()) {
                int before = byName.size();
                byName.values().removeIf(b -> owner.equals(b.owner()));
                removed += before - byName.size();
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("[{}] Removed {} capabilities", owner, removed);
        }
        return removed;
    }

    /**
     * canHandle 由插件实现，异常与链接错误都视为不支持
     */
    private boolean handles(FileCapability capability, Path path) {
        try {
            return capability.canHandle(path);
        } catch (RuntimeException | LinkageError e) {
            log.warn("canHandle failed for {} on {}: {}", capability.getName(), path, e.getMessage());
            return false;
        }
    }

    private record CapabilityBinding(Capability capability, String owner) {
    }
}
