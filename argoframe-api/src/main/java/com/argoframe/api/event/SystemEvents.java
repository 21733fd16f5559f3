package com.argoframe.api.event;

/**
 * 运行时自身发布的事件名
 * <p>
 * payload 均为新建的 Map，处理器之间不共享可变状态。
 * </p>
 */
public final class SystemEvents {

    /**
     * 插件注册完成，payload: {@code plugin} → 插件名
     */
    public static final String PLUGIN_LOADED = "plugin_loaded";

    /**
     * 插件被启用，payload: {@code plugin} → 插件名
     */
    public static final String PLUGIN_ENABLED = "plugin_enabled";

    /**
     * 插件被禁用，payload: {@code plugin} → 插件名
     */
    public static final String PLUGIN_DISABLED = "plugin_disabled";

    /**
     * 全部插件已关闭，payload: {@code count} → 关闭的插件数
     */
    public static final String PLUGINS_SHUTDOWN = "plugins_shutdown";

    /**
     * 运行时自身作为事件来源时的标识
     */
    public static final String RUNTIME_SOURCE = "argoframe";

    private SystemEvents() {
    }
}
