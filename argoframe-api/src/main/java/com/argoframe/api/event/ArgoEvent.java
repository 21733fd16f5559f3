package com.argoframe.api.event;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 事件
 * <p>
 * 事件本身不可变；payload 不做拷贝，多个处理器之间是否共享修改由具体事件约定。
 * </p>
 */
@Getter
public final class ArgoEvent {

    private final String name;
    private final Map<String, Object> payload;
    private final Instant timestamp;
    private final String source;
    private final EventPriority priority;

    @Builder
    private ArgoEvent(String name, Map<String, Object> payload, Instant timestamp,
                      String source, EventPriority priority) {
        this.name = name;
        this.payload = payload != null ? payload : new HashMap<>();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.source = source;
        this.priority = priority != null ? priority : EventPriority.NORMAL;
    }

    public static ArgoEvent of(String name, Map<String, Object> payload, String source) {
        return ArgoEvent.builder().name(name).payload(payload).source(source).build();
    }

    @Override
    public String toString() {
        return "ArgoEvent[name=" + name + ", source=" + source + ", timestamp=" + timestamp + "]";
    }
}
