package com.example.charging.service;

import com.example.charging.config.QueueConfig;
import com.example.charging.model.QueueEntry;
import com.example.charging.model.ReservationTimer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the persisted warning/expiry timer pair of reserved entries. At most one live pair
 * exists per entry: arming always drops whatever was armed before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationTimerService {

    private final QueueStore store;
    private final QueueConfig config;

    public TimerHandle arm(QueueEntry entry, LocalDateTime now) {
        LocalDateTime expiry = Objects.requireNonNull(entry.getReservationExpiry(), "reservation expiry");

        store.deleteTimers(entry.getId());

        LocalDateTime warningAt = expiry.minusMinutes(config.getWarningLeadMinutes());
        Long warningId = null;
        if (warningAt.isAfter(now)) {
            warningId = store.saveTimer(newTimer(entry, ReservationTimer.Kind.WARNING, warningAt)).getId();
        }
        Long expiryId = store.saveTimer(newTimer(entry, ReservationTimer.Kind.EXPIRY, expiry)).getId();

        log.debug("Armed timers for entry {}: warning={} expiry={} at {}", entry.getId(), warningId, expiryId, expiry);
        return new TimerHandle(entry.getId(), warningId, expiryId);
    }

    public void cancel(TimerHandle handle) {
        if (handle.warningTimerId() != null) {
            store.deleteTimer(handle.warningTimerId());
        }
        if (handle.expiryTimerId() != null) {
            store.deleteTimer(handle.expiryTimerId());
        }
    }

    /** The pair currently armed for the entry, if any. */
    public Optional<TimerHandle> armed(Long entryId) {
        List<ReservationTimer> rows = store.findTimers(entryId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Long warningId = null;
        Long expiryId = null;
        for (ReservationTimer row : rows) {
            if (row.getKind() == ReservationTimer.Kind.WARNING) {
                warningId = row.getId();
            } else {
                expiryId = row.getId();
            }
        }
        return Optional.of(new TimerHandle(entryId, warningId, expiryId));
    }

    public void markHandled(ReservationTimer timer) {
        store.deleteTimer(timer.getId());
    }

    /** Pushes a failed timer back with exponential backoff; the row is never dropped. */
    public ReservationTimer retryLater(ReservationTimer timer, LocalDateTime now) {
        int attempts = timer.getAttempts() + 1;
        timer.setAttempts(attempts);
        timer.setDueAt(now.plus(backoff(attempts)));
        log.warn("Timer {} ({} of entry {}) rescheduled to {} after {} failed attempt(s)",
                timer.getId(), timer.getKind(), timer.getQueueEntryId(), timer.getDueAt(), attempts);
        return store.saveTimer(timer);
    }

    Duration backoff(int attempts) {
        long base = Math.max(1, config.getTimerRetryBaseSeconds());
        long max = Math.max(base, config.getTimerRetryMaxSeconds());
        int shift = Math.min(Math.max(attempts - 1, 0), 20);
        return Duration.ofSeconds(Math.min(base << shift, max));
    }

    private ReservationTimer newTimer(QueueEntry entry, ReservationTimer.Kind kind, LocalDateTime fireAt) {
        return ReservationTimer.builder()
                .queueEntryId(entry.getId())
                .resourceId(entry.getResourceId())
                .kind(kind)
                .fireAt(fireAt)
                .dueAt(fireAt)
                .attempts(0)
                .build();
    }
}
