package com.example.charging.service.impl;

import com.example.charging.config.QueueConfig;
import com.example.charging.controllers.CapacityOracle;
import com.example.charging.controllers.NotificationEmitter;
import com.example.charging.dto.JoinResult;
import com.example.charging.dto.QueueEntryDTO;
import com.example.charging.dto.QueueError;
import com.example.charging.dto.QueueEvent;
import com.example.charging.dto.QueueEventType;
import com.example.charging.dto.QueueResult;
import com.example.charging.dto.QueueStatsDTO;
import com.example.charging.dto.ResourceCapacity;
import com.example.charging.dto.SessionStarted;
import com.example.charging.dto.SessionSummary;
import com.example.charging.model.LeaveReason;
import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import com.example.charging.model.ReservationTimer;
import com.example.charging.service.OperationContext;
import com.example.charging.service.PromotionEngine;
import com.example.charging.service.QueueCoordinator;
import com.example.charging.service.QueueStore;
import com.example.charging.service.ReservationTimerHandler;
import com.example.charging.service.ReservationTimerService;
import com.example.charging.service.ResourceLockRegistry;
import com.example.charging.service.SessionGate;
import com.example.charging.service.TimerHandle;
import com.example.charging.service.TxRunner;
import com.example.charging.service.exception.AlreadyQueuedException;
import com.example.charging.service.exception.NotEligibleException;
import com.example.charging.service.exception.QueueEntryNotFoundException;
import com.example.charging.service.exception.QueueFullException;
import com.example.charging.service.exception.QueueOperationException;
import com.example.charging.service.exception.ResourceUnavailableException;
import com.example.charging.service.util.PositionAllocator;
import com.example.charging.service.util.QueueStatsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueueCoordinatorImpl implements QueueCoordinator, ReservationTimerHandler {

    private static final int MAX_ATTEMPTS = 2;

    private final QueueStore store;
    private final CapacityOracle capacityOracle;
    private final NotificationEmitter notifications;
    private final PromotionEngine promotion;
    private final SessionGate sessionGate;
    private final ReservationTimerService timers;
    private final ResourceLockRegistry locks;
    private final TxRunner tx;
    private final QueueConfig config;
    private final Clock clock;

    @Override
    public QueueResult<JoinResult> join(String userId, Long resourceId) {
        return execute(resourceId, "join", ctx -> {
            ResourceCapacity capacity = ctx.getCapacity();
            if (capacity == null || !capacity.isAvailable()) {
                throw new ResourceUnavailableException("Station " + resourceId + " is not accepting queue entries");
            }

            Optional<QueueEntry> existing = store.findEntry(userId, resourceId);
            if (existing.filter(QueueEntry::isActive).isPresent()) {
                throw new AlreadyQueuedException("User " + userId + " already holds an entry on station " + resourceId);
            }

            List<QueueEntry> queued = store.findQueuedEntries(resourceId);
            int maxLength = Optional.ofNullable(capacity.getMaxQueueLength()).orElse(config.getDefaultMaxQueueLength());
            if (queued.size() >= maxLength) {
                throw new QueueFullException("Queue of station " + resourceId + " is full (" + queued.size() + "/" + maxLength + ")");
            }

            int position = PositionAllocator.nextPosition(queued);
            int wait = PositionAllocator.estimateWait(position, ctx.getAverageUsageMinutes(), config.getMinimumWaitMinutes());

            // a terminal row of the same pair is reused
            QueueEntry entry = existing.orElseGet(() -> QueueEntry.builder()
                    .userId(userId)
                    .resourceId(resourceId)
                    .createdAt(ctx.getNow())
                    .build());
            entry.setStatus(QueueStatus.WAITING);
            entry.setPosition(position);
            entry.setEstimatedWaitMinutes(wait);
            entry.setReservationExpiry(null);
            entry.setExtensionCount(0);
            entry.setJoinedAt(ctx.getNow());
            entry.setUpdatedAt(ctx.getNow());
            entry = store.saveEntry(entry);

            ctx.emit(QueueEventType.JOINED, entry, Map.of(
                    "position", position,
                    "estimatedWaitMinutes", wait,
                    "queueLength", queued.size() + 1
            ));
            log.info("User {} joined station {} at position {} (wait ~{} min)", userId, resourceId, position, wait);

            return new JoinResult(entry.getId(), position, wait);
        });
    }

    @Override
    public QueueResult<Boolean> leave(String userId, Long resourceId, LeaveReason reason) {
        LeaveReason effective = reason == null ? LeaveReason.USER_CANCELLED : reason;
        return execute(resourceId, "leave", ctx -> {
            QueueEntry entry = requireActive(userId, resourceId);
            String reasonCode = effective.name().toLowerCase(Locale.ROOT);
            Integer heldPosition = entry.getPosition();

            timers.armed(entry.getId()).ifPresent(timers::cancel);
            if (entry.getStatus() == QueueStatus.CHARGING) {
                sessionGate.closeOpenSession(ctx, entry, reasonCode);
            }

            entry.setStatus(effective.targetStatus());
            entry.setReservationExpiry(null);
            entry.setPosition(null);
            entry.setUpdatedAt(ctx.getNow());
            store.saveEntry(entry);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reason", reasonCode);
            payload.put("previousPosition", heldPosition);
            ctx.emit(QueueEventType.LEFT, entry, payload);
            log.info("User {} left station {} ({}), was at position {}", userId, resourceId, reasonCode, heldPosition);

            promotion.release(ctx, heldPosition);
            return Boolean.TRUE;
        });
    }

    @Override
    public QueueResult<Boolean> reserve(String userId, Long resourceId, int ttlMinutes) {
        int ttl = ttlMinutes > 0 ? ttlMinutes : config.getReservationTtlMinutes();
        return execute(resourceId, "reserve", ctx -> {
            QueueEntry entry = requireActive(userId, resourceId);
            if (!entry.isHead() || entry.getStatus() != QueueStatus.WAITING) {
                throw new NotEligibleException("Entry " + entry.getId() + " is " + entry.getStatus()
                        + " at position " + entry.getPosition() + ", only a waiting head can reserve");
            }

            TimerHandle handle = promotion.reserve(ctx, entry, ttl);

            ctx.emit(QueueEventType.RESERVED, entry, Map.of(
                    "reservationExpiry", entry.getReservationExpiry(),
                    "ttlMinutes", ttl
            ));
            log.info("User {} reserved station {} until {} (expiry timer {})",
                    userId, resourceId, entry.getReservationExpiry(), handle.expiryTimerId());
            return Boolean.TRUE;
        });
    }

    @Override
    public QueueResult<Boolean> extendReservation(String userId, Long resourceId) {
        return execute(resourceId, "extend", ctx -> {
            QueueEntry entry = requireActive(userId, resourceId);
            if (entry.getStatus() != QueueStatus.RESERVED) {
                throw new NotEligibleException("Entry " + entry.getId() + " holds no reservation");
            }
            if (entry.getExtensionCount() >= config.getMaxExtensions()) {
                throw new NotEligibleException("Reservation of entry " + entry.getId() + " was already extended "
                        + entry.getExtensionCount() + " time(s)");
            }

            entry.setReservationExpiry(entry.getReservationExpiry().plusMinutes(config.getExtensionMinutes()));
            entry.setExtensionCount(entry.getExtensionCount() + 1);
            entry.setUpdatedAt(ctx.getNow());
            store.saveEntry(entry);
            TimerHandle handle = timers.arm(entry, ctx.getNow());

            ctx.emit(QueueEventType.RESERVATION_EXTENDED, entry, Map.of(
                    "reservationExpiry", entry.getReservationExpiry(),
                    "extensionsLeft", config.getMaxExtensions() - entry.getExtensionCount()
            ));
            log.info("User {} extended reservation on station {} until {} (expiry timer {})",
                    userId, resourceId, entry.getReservationExpiry(), handle.expiryTimerId());
            return Boolean.TRUE;
        });
    }

    @Override
    public QueueResult<SessionStarted> startSession(String userId, Long resourceId, BigDecimal startMeterReading) {
        return execute(resourceId, "startSession", ctx -> sessionGate.start(ctx, userId, startMeterReading));
    }

    @Override
    public QueueResult<SessionSummary> stopSession(String userId, Long resourceId, BigDecimal endMeterReading) {
        return execute(resourceId, "stopSession", ctx -> sessionGate.stop(ctx, userId, endMeterReading));
    }

    @Override
    public Optional<QueueEntryDTO> getStatus(String userId, Long resourceId) {
        return store.findEntry(userId, resourceId).map(QueueEntryDTO::from);
    }

    @Override
    public List<QueueEntryDTO> getUserQueues(String userId) {
        return store.findActiveEntries(userId).stream()
                .map(QueueEntryDTO::from)
                .toList();
    }

    @Override
    public QueueStatsDTO getQueueStats(Long resourceId) {
        LocalDateTime now = LocalDateTime.now(clock);
        int queued = store.findQueuedEntries(resourceId).size();
        int fallback = averageUsageMinutes(capacityOracle.getCapacity(resourceId));
        List<QueueEntry> recent = store.findEntriesJoinedSince(resourceId, now.minusDays(30));
        return QueueStatsCalculator.calculate(resourceId, queued, recent, now, fallback);
    }

    @Override
    public void onTimerDue(ReservationTimer due) {
        Long resourceId = due.getResourceId();
        locks.withLock(resourceId, () -> {
            OperationContext ctx = newContext(resourceId);
            tx.required(() -> fire(ctx, due.getId()));
            publish(ctx.getEvents());
            return null;
        });
    }

    // ------------------ timers ------------------

    private void fire(OperationContext ctx, Long timerId) {
        Optional<ReservationTimer> current = store.findTimer(timerId);
        if (current.isEmpty()) {
            log.debug("Timer {} is gone, nothing to do", timerId);
            return;
        }
        ReservationTimer timer = current.get();

        // the row is removed only once handling went through, so a failure leaves it for a retry
        QueueEntry entry = store.findEntry(timer.getQueueEntryId()).orElse(null);
        if (entry == null || entry.getStatus() != QueueStatus.RESERVED) {
            log.debug("Timer {} fired for entry {} which is no longer reserved", timerId, timer.getQueueEntryId());
            timers.markHandled(timer);
            return;
        }

        switch (timer.getKind()) {
            case WARNING -> {
                warn(ctx, entry);
                timers.markHandled(timer);
            }
            // disarms the entry's whole pair, this row included
            case EXPIRY -> expire(ctx, entry);
        }
    }

    private void warn(OperationContext ctx, QueueEntry entry) {
        long minutesLeft = Math.max(0, Duration.between(ctx.getNow(), entry.getReservationExpiry()).toMinutes());
        ctx.emit(QueueEventType.RESERVATION_WARNING, entry, Map.of(
                "reservationExpiry", entry.getReservationExpiry(),
                "minutesLeft", minutesLeft
        ));
        log.info("Reservation of user {} on station {} expires in {} min", entry.getUserId(), entry.getResourceId(), minutesLeft);
    }

    private void expire(OperationContext ctx, QueueEntry entry) {
        LocalDateTime expiry = entry.getReservationExpiry();
        Integer heldPosition = entry.getPosition();

        timers.armed(entry.getId()).ifPresent(timers::cancel);
        entry.setStatus(QueueStatus.CANCELLED);
        entry.setReservationExpiry(null);
        entry.setPosition(null);
        entry.setUpdatedAt(ctx.getNow());
        store.saveEntry(entry);

        ctx.emit(QueueEventType.EXPIRED, entry, Map.of("reservationExpiry", expiry));
        log.info("Reservation of user {} on station {} expired at {}", entry.getUserId(), entry.getResourceId(), expiry);

        if (heldPosition != null) {
            promotion.vacate(ctx, heldPosition);
        }
    }

    // ------------------ plumbing ------------------

    private QueueEntry requireActive(String userId, Long resourceId) {
        return store.findEntry(userId, resourceId)
                .filter(QueueEntry::isActive)
                .orElseThrow(() -> new QueueEntryNotFoundException(
                        "No active entry for user " + userId + " on station " + resourceId));
    }

    /**
     * Runs one operation under the resource lock and inside a transaction, then emits
     * the collected notification intents. A version or uniqueness clash is retried once.
     */
    private <T> QueueResult<T> execute(Long resourceId, String operation, Function<OperationContext, T> body) {
        for (int attempt = 1; ; attempt++) {
            try {
                T value = locks.withLock(resourceId, () -> {
                    OperationContext ctx = newContext(resourceId);
                    T result = tx.required(() -> body.apply(ctx));
                    publish(ctx.getEvents());
                    return result;
                });
                return QueueResult.ok(value);
            } catch (QueueOperationException e) {
                log.warn("{} rejected on station {}: {}", operation, resourceId, e.getMessage());
                return QueueResult.failure(e.getError());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (attempt < MAX_ATTEMPTS) {
                    log.warn("{} on station {} hit a concurrent write, retrying: {}", operation, resourceId, e.getMessage());
                    continue;
                }
                log.error("{} on station {} failed after {} attempts: {}", operation, resourceId, attempt, e.getMessage());
                return QueueResult.failure(QueueError.CONCURRENCY_CONFLICT);
            }
        }
    }

    private OperationContext newContext(Long resourceId) {
        ResourceCapacity capacity = capacityOracle.getCapacity(resourceId);
        return new OperationContext(resourceId, LocalDateTime.now(clock), capacity, averageUsageMinutes(capacity));
    }

    private int averageUsageMinutes(ResourceCapacity capacity) {
        if (capacity == null || capacity.getAverageUsageMinutes() == null) {
            return config.getDefaultAverageUsageMinutes();
        }
        return capacity.getAverageUsageMinutes();
    }

    private void publish(List<QueueEvent> events) {
        for (QueueEvent event : events) {
            try {
                notifications.emit(event);
            } catch (Exception e) {
                log.warn("Failed to emit {} for user {} on station {}: {}",
                        event.type(), event.userId(), event.resourceId(), e.getMessage());
            }
        }
    }
}
