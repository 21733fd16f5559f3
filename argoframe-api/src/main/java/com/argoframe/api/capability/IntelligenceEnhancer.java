package com.argoframe.api.capability;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 检索增强策略
 * 例如 corrective_rag、query_planning、self_reflection
 */
public interface IntelligenceEnhancer extends Capability {

    /**
     * 能力标签，{@code PluginManager#getIntelligencePlugin} 按此查找
     */
    String getCapability();

    CompletableFuture<Map<String, Object>> enhance(String query, Map<String, Object> context);
}
