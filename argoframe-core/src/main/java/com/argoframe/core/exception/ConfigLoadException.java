package com.argoframe.core.exception;

import com.argoframe.api.exception.ArgoException;

/**
 * 配置文件读取或解析失败
 */
public class ConfigLoadException extends ArgoException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
