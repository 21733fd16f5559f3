package com.argoframe.core.fixture;

import com.argoframe.api.context.PluginContext;
import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.api.plugin.PluginMetadata;

/**
 * 先注册分析器、再在 initialize 中失败的插件
 */
public class PartialPlugin implements ArgoPlugin {

    public static final String NAME = "partial-plugin";

    @Override
    public PluginMetadata getMetadata() {
        return PluginMetadata.builder().name(NAME).version("0.0.1").build();
    }

    @Override
    public void initialize(PluginContext context) {
        context.getCapabilityRegistry().registerAnalyzer(new PdfAnalyzer());
        throw new IllegalStateException("initialize failed after registering an analyzer");
    }
}
