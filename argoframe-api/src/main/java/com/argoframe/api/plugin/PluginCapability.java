package com.argoframe.api.plugin;

/**
 * 插件声明的能力标签
 * 仅用于描述与展示，实际注册走 {@link com.argoframe.api.capability.CapabilityKind}
 */
public enum PluginCapability {
    ANALYZER("analyzer"),
    EXTRACTOR("extractor"),
    EVALUATOR("evaluator"),
    TRANSFORMER("transformer"),
    EXPORTER("exporter"),
    INTELLIGENCE("intelligence");

    private final String value;

    PluginCapability(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
