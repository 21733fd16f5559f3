package com.argoframe.api.capability;

/**
 * 可插拔能力的公共契约
 */
public interface Capability {

    /**
     * 能力名称，在同一 {@link CapabilityKind} 内唯一
     */
    String getName();
}
