package com.argoframe.api.exception;

import lombok.Getter;

/**
 * 参数非法异常
 * 在 API 边界上直接反馈给调用方，例如空事件名、空回调
 *
 * @author ArgoFrame
 */
@Getter
public class InvalidArgumentException extends ArgoException {

    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super(message);
        this.argument = argument;
    }
}
