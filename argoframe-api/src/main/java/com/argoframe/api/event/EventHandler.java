package com.argoframe.api.event;

/**
 * 事件处理器
 * 抛出的任何异常都会在派发边界被捕获并记录，不会影响其他处理器
 *
 * @author ArgoFrame
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(ArgoEvent event) throws Exception;
}
