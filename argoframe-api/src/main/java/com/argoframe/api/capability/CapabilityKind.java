package com.argoframe.api.capability;

/**
 * 能力种类，每种对应一个独立的名称空间
 */
public enum CapabilityKind {
    ANALYZER(Analyzer.class),
    EXTRACTOR(Extractor.class),
    EVALUATOR(Evaluator.class),
    INTELLIGENCE_ENHANCER(IntelligenceEnhancer.class);

    private final Class<? extends Capability> type;

    CapabilityKind(Class<? extends Capability> type) {
        this.type = type;
    }

    public Class<? extends Capability> type() {
        return type;
    }

    /**
     * 是否按文件扩展名分派
     */
    public boolean isFileBased() {
        return FileCapability.class.isAssignableFrom(type);
    }
}
