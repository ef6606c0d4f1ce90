package com.example.charging.dto;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Notification intent handed to the outside delivery channel. */
public record QueueEvent(QueueEventType type,
                         String userId,
                         Long resourceId,
                         Map<String, Object> payload,
                         LocalDateTime occurredAt) {

    public QueueEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
