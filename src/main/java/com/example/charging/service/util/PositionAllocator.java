package com.example.charging.service.util;

import com.example.charging.model.QueueEntry;

import java.util.Collection;
import java.util.Objects;

public final class PositionAllocator {

    private PositionAllocator() {
    }

    /** max(position) + 1 over the queued entries, or 1 for an empty line. */
    public static int nextPosition(Collection<QueueEntry> queued) {
        return queued.stream()
                .map(QueueEntry::getPosition)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0) + 1;
    }

    public static int estimateWait(int position, int averageUsageMinutes, int minimumWaitMinutes) {
        if (position <= 1) {
            return minimumWaitMinutes;
        }
        return (position - 1) * Math.max(0, averageUsageMinutes) + minimumWaitMinutes;
    }
}
