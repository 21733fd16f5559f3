package com.argoframe.api.context;

import com.argoframe.api.capability.CapabilityRegistry;
import com.argoframe.api.event.EventBus;
import com.argoframe.api.hook.HookPipeline;

import java.util.Optional;

/**
 * 宿主上下文
 * 在 {@link com.argoframe.api.plugin.ArgoPlugin#initialize(PluginContext)} 时传给插件，
 * 提供配置读取与三大运行时组件的入口
 *
 * @author ArgoFrame
 */
public interface PluginContext {

    /**
     * 获取当前插件的名称
     * @return 插件名
     */
    String getPluginName();

    /**
     * 获取配置
     * 查找顺序：插件清单 properties → 宿主配置 properties → JVM 系统属性
     * @param key 配置键
     * @return 配置值
     */
    Optional<String> getProperty(String key);

    default String getProperty(String key, String defaultValue) {
        return getProperty(key).orElse(defaultValue);
    }

    /**
     * 能力注册表（分析器、抽取器、评估器、智能增强器）
     */
    CapabilityRegistry getCapabilityRegistry();

    /**
     * 事件总线
     * 通过此入口订阅的处理器归属于当前插件，插件被禁用时不会被调用
     */
    EventBus getEventBus();

    /**
     * 钩子管道
     * 通过此入口注册的回调归属于当前插件，插件被禁用时会被跳过
     */
    HookPipeline getHookPipeline();
}
