package com.example.charging.service;

import com.example.charging.dto.QueueEventType;
import com.example.charging.dto.SessionStarted;
import com.example.charging.dto.SessionSummary;
import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import com.example.charging.model.UsageSession;
import com.example.charging.service.exception.NoActiveReservationException;
import com.example.charging.service.exception.QueueEntryNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moves a queue entry into and out of an active usage session. A charging entry has left
 * the line: it holds no position and does not count toward the queue length.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionGate {

    private final QueueStore store;
    private final ReservationTimerService timers;
    private final PromotionEngine promotion;

    public SessionStarted start(OperationContext ctx, String userId, BigDecimal startMeterReading) {
        QueueEntry entry = store.findEntry(userId, ctx.getResourceId())
                .filter(QueueEntry::isQueued)
                .orElseThrow(() -> new NoActiveReservationException(
                        "No waiting or reserved entry for user " + userId + " on resource " + ctx.getResourceId()));

        timers.armed(entry.getId()).ifPresent(timers::cancel);

        // the join-time wait estimate is kept for queue statistics
        Integer heldPosition = entry.getPosition();
        entry.setStatus(QueueStatus.CHARGING);
        entry.setReservationExpiry(null);
        entry.setPosition(null);
        entry.setUpdatedAt(ctx.getNow());
        store.saveEntry(entry);

        UsageSession session = store.saveSession(UsageSession.builder()
                .queueEntryId(entry.getId())
                .resourceId(entry.getResourceId())
                .userId(entry.getUserId())
                .startedAt(ctx.getNow())
                .startMeterReading(startMeterReading)
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("startedAt", session.getStartedAt());
        payload.put("startMeterReading", startMeterReading);
        ctx.emit(QueueEventType.SESSION_STARTED, entry, payload);

        log.info("Session {} started for user {} on resource {}", session.getId(), userId, ctx.getResourceId());

        if (heldPosition != null) {
            promotion.vacate(ctx, heldPosition);
        }
        return new SessionStarted(session.getId(), session.getStartedAt());
    }

    public SessionSummary stop(OperationContext ctx, String userId, BigDecimal endMeterReading) {
        QueueEntry entry = store.findEntry(userId, ctx.getResourceId())
                .filter(e -> e.getStatus() == QueueStatus.CHARGING)
                .orElseThrow(() -> new QueueEntryNotFoundException(
                        "No charging entry for user " + userId + " on resource " + ctx.getResourceId()));
        UsageSession session = store.findOpenSession(entry.getId())
                .orElseThrow(() -> new QueueEntryNotFoundException("No open session for entry " + entry.getId()));

        close(ctx, session, endMeterReading, "completed");

        Integer heldPosition = entry.getPosition();
        entry.setStatus(QueueStatus.COMPLETED);
        entry.setPosition(null);
        entry.setUpdatedAt(ctx.getNow());
        store.saveEntry(entry);

        SessionSummary summary = new SessionSummary(session.getId(), session.getStartedAt(), session.getEndedAt(),
                session.getStartMeterReading(), session.getEndMeterReading());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", summary.sessionId());
        payload.put("startedAt", summary.startedAt());
        payload.put("endedAt", summary.endedAt());
        payload.put("startMeterReading", summary.startMeterReading());
        payload.put("endMeterReading", summary.endMeterReading());
        ctx.emit(QueueEventType.SESSION_COMPLETED, entry, payload);

        log.info("Session {} completed for user {} on resource {}", session.getId(), userId, ctx.getResourceId());

        promotion.release(ctx, heldPosition);
        return summary;
    }

    /** Ends the open session of an entry that leaves by another path. */
    public Optional<UsageSession> closeOpenSession(OperationContext ctx, QueueEntry entry, String reason) {
        return store.findOpenSession(entry.getId())
                .map(session -> close(ctx, session, null, reason));
    }

    private UsageSession close(OperationContext ctx, UsageSession session, BigDecimal endMeterReading, String reason) {
        session.setEndedAt(ctx.getNow());
        session.setEndMeterReading(endMeterReading);
        session.setStopReason(reason);
        return store.saveSession(session);
    }
}
