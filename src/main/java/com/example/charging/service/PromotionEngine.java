package com.example.charging.service;

import com.example.charging.config.QueueConfig;
import com.example.charging.dto.QueueEventType;
import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import com.example.charging.service.util.PositionAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps positions dense when someone leaves the line and hands the reservation to the
 * new head. Callers must save the departing entry before calling {@link #vacate}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromotionEngine {

    private final QueueStore store;
    private final ReservationTimerService timers;
    private final QueueConfig config;

    public void vacate(OperationContext ctx, int vacatedPosition) {
        compact(ctx, vacatedPosition);
        if (vacatedPosition == 1) {
            promote(ctx);
        }
    }

    /**
     * Called after an entry stopped holding the slot or its place in line. A charging entry
     * holds no position, so its departure only offers the freed slot to the head.
     */
    public void release(OperationContext ctx, Integer heldPosition) {
        if (heldPosition != null) {
            vacate(ctx, heldPosition);
        } else {
            promote(ctx);
        }
    }

    /** Moves every queued entry behind {@code vacatedPosition} one place forward. */
    public void compact(OperationContext ctx, int vacatedPosition) {
        int moved = 0;
        for (QueueEntry entry : store.findQueuedEntries(ctx.getResourceId())) {
            if (entry.getPosition() == null || entry.getPosition() <= vacatedPosition) {
                continue;
            }
            int position = entry.getPosition() - 1;
            int wait = PositionAllocator.estimateWait(position, ctx.getAverageUsageMinutes(), config.getMinimumWaitMinutes());
            entry.setPosition(position);
            entry.setEstimatedWaitMinutes(wait);
            entry.setUpdatedAt(ctx.getNow());
            store.saveEntry(entry);
            moved++;

            ctx.emit(QueueEventType.POSITION_UPDATED, entry, Map.of(
                    "position", position,
                    "estimatedWaitMinutes", wait
            ));
        }
        log.debug("Compacted resource {} after position {} left: {} entries moved", ctx.getResourceId(), vacatedPosition, moved);
    }

    /** Reserves the slot for the position-1 entry if it is still waiting. */
    public Optional<QueueEntry> promote(OperationContext ctx) {
        List<QueueEntry> queued = store.findQueuedEntries(ctx.getResourceId());
        if (queued.isEmpty()) {
            log.debug("Nothing to promote on resource {}", ctx.getResourceId());
            return Optional.empty();
        }
        if (queued.stream().anyMatch(e -> e.getStatus() == QueueStatus.RESERVED)) {
            return Optional.empty();
        }

        QueueEntry head = queued.get(0);
        if (!head.isHead() || head.getStatus() != QueueStatus.WAITING) {
            return Optional.empty();
        }

        int ttl = config.getReservationTtlMinutes();
        TimerHandle handle = reserve(ctx, head, ttl);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reservationExpiry", head.getReservationExpiry());
        payload.put("ttlMinutes", ttl);
        ctx.emit(QueueEventType.PROMOTED, head, payload);

        log.info("Promoted user {} on resource {}, reservation until {} (expiry timer {})",
                head.getUserId(), head.getResourceId(), head.getReservationExpiry(), handle.expiryTimerId());
        return Optional.of(head);
    }

    public TimerHandle reserve(OperationContext ctx, QueueEntry entry, int ttlMinutes) {
        entry.setStatus(QueueStatus.RESERVED);
        entry.setReservationExpiry(ctx.getNow().plusMinutes(ttlMinutes));
        entry.setExtensionCount(0);
        entry.setUpdatedAt(ctx.getNow());
        store.saveEntry(entry);
        return timers.arm(entry, ctx.getNow());
    }
}
