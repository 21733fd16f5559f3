package com.argoframe.api.event;

/**
 * 事件处理器优先级，数值越大越先执行
 */
public enum EventPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    EventPriority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
