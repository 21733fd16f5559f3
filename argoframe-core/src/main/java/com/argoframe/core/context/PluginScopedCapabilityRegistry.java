package com.argoframe.core.context;

import com.argoframe.api.capability.Capability;
import com.argoframe.api.capability.CapabilityKind;
import com.argoframe.api.capability.CapabilityRegistry;
import com.argoframe.api.capability.IntelligenceEnhancer;
import com.argoframe.core.capability.DefaultCapabilityRegistry;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 插件视角的能力注册表，注册的能力归属于插件
 */
@RequiredArgsConstructor
class PluginScopedCapabilityRegistry implements CapabilityRegistry {

    private final String pluginName;
    private final DefaultCapabilityRegistry delegate;

    @Override
    public boolean register(CapabilityKind kind, Capability capability) {
        return delegate.register(pluginName, kind, capability);
    }

    @Override
    public Optional<Capability> lookupForFile(CapabilityKind kind, Path path) {
        return delegate.lookupForFile(kind, path);
    }

    @Override
    public Optional<Capability> lookupByName(CapabilityKind kind, String name) {
        return delegate.lookupByName(kind, name);
    }

    @Override
    public List<Capability> list(CapabilityKind kind) {
        return delegate.list(kind);
    }

    @Override
    public Optional<IntelligenceEnhancer> findEnhancer(String capability) {
        return delegate.findEnhancer(capability);
    }

    @Override
    public void clear() {
        delegate.clear();
    }
}
