package com.argoframe.api.plugin;

import com.argoframe.api.context.PluginContext;

/**
 * 插件生命周期接口
 * 所有插件的主入口类必须实现此接口，并提供无参构造器
 * <p>
 * 发现约定：插件单元中类名以 {@code Plugin} 结尾的实现类会被自动实例化，
 * 或在 plugin.yml 的 {@code pluginClasses} 中显式声明。
 * </p>
 *
 * @author ArgoFrame
 */
public interface ArgoPlugin {

    /**
     * 插件元数据，名称在同一个 PluginManager 内唯一
     *
     * @return 元数据
     */
    PluginMetadata getMetadata();

    /**
     * 插件初始化时调用
     * 插件应在此处向能力注册表、事件总线、钩子管道注册自己
     *
     * @param context 宿主上下文
     */
    void initialize(PluginContext context);

    /**
     * 插件关闭时调用
     * 用于释放资源
     */
    default void shutdown() {
        // Default empty implementation
    }

    /**
     * 健康检查
     *
     * @return 健康返回 true
     */
    default boolean healthCheck() {
        return true;
    }
}
