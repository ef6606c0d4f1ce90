package com.example.charging.service;

import com.example.charging.dto.QueueEvent;
import com.example.charging.dto.QueueEventType;
import com.example.charging.dto.ResourceCapacity;
import com.example.charging.model.QueueEntry;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * State shared by the steps of one serialized operation on a resource: the operation's
 * clock reading, the resource's usage figure, and the notification intents to emit after commit.
 */
@Getter
public class OperationContext {

    private final Long resourceId;
    private final LocalDateTime now;
    /** null when the capacity oracle does not know the resource */
    private final ResourceCapacity capacity;
    private final int averageUsageMinutes;
    private final List<QueueEvent> events = new ArrayList<>();

    public OperationContext(Long resourceId, LocalDateTime now, ResourceCapacity capacity, int averageUsageMinutes) {
        this.resourceId = resourceId;
        this.now = now;
        this.capacity = capacity;
        this.averageUsageMinutes = averageUsageMinutes;
    }

    public void emit(QueueEventType type, QueueEntry entry, Map<String, Object> payload) {
        events.add(new QueueEvent(type, entry.getUserId(), entry.getResourceId(), payload, now));
    }

    public List<QueueEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
