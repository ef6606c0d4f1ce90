package com.example.charging.service;

import com.example.charging.config.QueueConfig;
import com.example.charging.model.ReservationTimer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fires persisted reservation timers whose due time has passed. A timer that fails is
 * pushed back with backoff and picked up by a later sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationTimerSweeper {

    private final QueueStore store;
    private final ReservationTimerHandler handler;
    private final ReservationTimerService timerService;
    private final ResourceLockRegistry locks;
    private final TxRunner tx;
    private final QueueConfig config;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${queue.timers.sweep-interval-ms:5000}")
    public void sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ReservationTimer> due = store.findDueTimers(now, config.getTimerBatchSize());
        if (due.isEmpty()) return;

        log.debug("Sweeping {} due reservation timer(s)", due.size());
        for (ReservationTimer timer : due) {
            try {
                handler.onTimerDue(timer);
            } catch (Exception e) {
                log.error("Timer {} ({} of entry {}) failed: {}", timer.getId(), timer.getKind(), timer.getQueueEntryId(), e.toString());
                reschedule(timer.getId(), timer.getResourceId(), now);
            }
        }
    }

    private void reschedule(Long timerId, Long resourceId, LocalDateTime now) {
        try {
            locks.withLock(resourceId, () -> tx.required(() -> store.findTimer(timerId)
                    .map(current -> timerService.retryLater(current, now))
                    .orElse(null)));
        } catch (Exception e) {
            log.error("Could not reschedule timer {}, it stays due: {}", timerId, e.toString());
        }
    }
}
