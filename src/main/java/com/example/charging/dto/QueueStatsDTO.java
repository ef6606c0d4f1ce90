package com.example.charging.dto;

import java.util.List;

public record QueueStatsDTO(Long resourceId, int totalInQueue, int averageWaitMinutes, List<String> peakHours) {

    public QueueStatsDTO {
        peakHours = peakHours == null ? List.of() : List.copyOf(peakHours);
    }
}
