package com.argoframe.api.exception;

/**
 * ArgoFrame 基础异常
 *
 * @author ArgoFrame
 */
public class ArgoException extends RuntimeException {

    public ArgoException(String message) {
        super(message);
    }

    public ArgoException(String message, Throwable cause) {
        super(message, cause);
    }
}
