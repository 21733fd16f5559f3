package com.argoframe.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ArgoFrame Core 全局配置对象
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽宿主环境的差异。
 * 由宿主显式构造并传给 PluginManager，不存在全局单例。
 */
@Data
@Builder
@ToString
public class ArgoFrameConfig {

    // ================= 插件发现 =================

    /**
     * 启动时是否自动扫描并加载 home 目录下的插件。
     */
    @Builder.Default
    private boolean autoScan = true;

    /**
     * 插件存放根目录
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 插件单元匹配规则 (glob)，作用于 home 目录下的一级条目名
     */
    @Builder.Default
    private String pluginPattern = "*-plugin*";

    /**
     * 没有 plugin.yml 时，按此类名后缀扫描插件入口类
     */
    @Builder.Default
    private String pluginClassSuffix = "Plugin";

    // ================= 事件总线 =================

    /**
     * 事件历史环形缓冲容量
     */
    @Builder.Default
    private int eventHistoryCapacity = 100;

    /**
     * 异步派发线程数
     */
    @Builder.Default
    private int asyncPoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());

    // ================= 宿主配置 =================

    /**
     * 暴露给插件的配置项，key 为点分路径，例如 {@code llm.model}
     */
    @Builder.Default
    private Map<String, String> properties = new HashMap<>();

    public Optional<String> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public static ArgoFrameConfig defaults() {
        return ArgoFrameConfig.builder().build();
    }
}
