package com.argoframe.core.exception;

import com.argoframe.api.exception.ArgoException;
import lombok.Getter;

/**
 * 插件单元加载失败（清单解析、类加载、实例化）
 * 只在发现流程内部抛出，按单元捕获，不会中断整体加载
 */
@Getter
public class PluginLoadException extends ArgoException {

    private final String unit;

    public PluginLoadException(String unit, String message) {
        super(message);
        this.unit = unit;
    }

    public PluginLoadException(String unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }
}
