package com.example.charging.service.util;

import com.example.charging.dto.QueueStatsDTO;
import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

public final class QueueStatsCalculator {

    static final int AVERAGE_WINDOW_DAYS = 7;
    static final int PEAK_WINDOW_DAYS = 30;
    private static final int PEAK_HOURS = 3;

    private QueueStatsCalculator() {
    }

    /**
     * @param recent entries joined within the last {@value #PEAK_WINDOW_DAYS} days
     */
    public static QueueStatsDTO calculate(Long resourceId,
                                          int queuedCount,
                                          Collection<QueueEntry> recent,
                                          LocalDateTime now,
                                          int fallbackWaitMinutes) {
        LocalDateTime averageFrom = now.minusDays(AVERAGE_WINDOW_DAYS);
        LocalDateTime peakFrom = now.minusDays(PEAK_WINDOW_DAYS);

        OptionalDouble average = recent.stream()
                .filter(e -> e.getStatus() == QueueStatus.COMPLETED)
                .filter(e -> e.getJoinedAt() != null && e.getJoinedAt().isAfter(averageFrom))
                .filter(e -> e.getEstimatedWaitMinutes() != null)
                .mapToInt(QueueEntry::getEstimatedWaitMinutes)
                .average();

        int averageWait = (int) Math.round(average.orElse(0));
        if (averageWait <= 0) {
            averageWait = fallbackWaitMinutes;
        }

        return new QueueStatsDTO(resourceId, queuedCount, averageWait, peakHours(recent, peakFrom));
    }

    static List<String> peakHours(Collection<QueueEntry> recent, LocalDateTime from) {
        Map<Integer, Long> byHour = recent.stream()
                .map(QueueEntry::getJoinedAt)
                .filter(joined -> joined != null && joined.isAfter(from))
                .collect(Collectors.groupingBy(LocalDateTime::getHour, Collectors.counting()));

        return byHour.entrySet().stream()
                .sorted(Map.Entry.<Integer, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(PEAK_HOURS)
                .map(Map.Entry::getKey)
                .map(hour -> hour + ":00-" + (hour + 1) + ":00")
                .toList();
    }
}
