package com.argoframe.core.plugin;

/**
 * 插件生命周期状态
 * <p>
 * DISCOVERED → INSTANTIATED → INITIALIZED → (ACTIVE ⇄ DISABLED) → SHUTDOWN
 * </p>
 */
public enum PluginState {
    // 单元已发现，入口类尚未实例化
    DISCOVERED,
    INSTANTIATED,
    INITIALIZED,
    ACTIVE,
    DISABLED,
    SHUTDOWN;

    /**
     * 已完成初始化且尚未关闭
     */
    public boolean isRunning() {
        return this == ACTIVE || this == DISABLED;
    }
}
