package com.example.charging.support;

import com.example.charging.config.QueueConfig;
import com.example.charging.controllers.CapacityOracle;
import com.example.charging.controllers.NotificationEmitter;
import com.example.charging.dto.QueueEvent;
import com.example.charging.dto.QueueEventType;
import com.example.charging.dto.ResourceCapacity;
import com.example.charging.service.PromotionEngine;
import com.example.charging.service.ReservationTimerService;
import com.example.charging.service.ReservationTimerSweeper;
import com.example.charging.service.ResourceLockRegistry;
import com.example.charging.service.SessionGate;
import com.example.charging.service.TxRunner;
import com.example.charging.service.impl.InMemoryQueueStore;
import com.example.charging.service.impl.QueueCoordinatorImpl;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;

/**
 * Wires the real coordinator over the in-memory store, a movable clock and mocked
 * capacity/notification collaborators.
 */
public class QueueFixture {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final QueueConfig config = defaultConfig();
    public final InMemoryQueueStore store;
    public final CapacityOracle oracle = Mockito.mock(CapacityOracle.class);
    public final NotificationEmitter emitter = Mockito.mock(NotificationEmitter.class);
    public final TxRunner tx = new TxRunner() {
        @Override
        public <T> T required(Supplier<T> body) {
            return body.get();
        }
    };
    public final ResourceLockRegistry locks = new ResourceLockRegistry();
    public final ReservationTimerService timers;
    public final PromotionEngine promotion;
    public final SessionGate sessions;
    public final QueueCoordinatorImpl coordinator;
    public final ReservationTimerSweeper sweeper;

    public QueueFixture() {
        this(new InMemoryQueueStore());
    }

    /** @param store usually a Mockito spy when a test needs the store to fail */
    public QueueFixture(InMemoryQueueStore store) {
        this.store = store;
        this.timers = new ReservationTimerService(store, config);
        this.promotion = new PromotionEngine(store, timers, config);
        this.sessions = new SessionGate(store, timers, promotion);
        this.coordinator = new QueueCoordinatorImpl(
                store, oracle, emitter, promotion, sessions, timers, locks, tx, config, clock);
        this.sweeper = new ReservationTimerSweeper(store, coordinator, timers, locks, tx, config, clock);
    }

    public QueueFixture station(int maxQueueLength, int averageUsageMinutes) {
        Mockito.when(oracle.getCapacity(anyLong())).thenAnswer(inv -> ResourceCapacity.builder()
                .resourceId(inv.getArgument(0))
                .active(true)
                .open(true)
                .maxQueueLength(maxQueueLength)
                .averageUsageMinutes(averageUsageMinutes)
                .build());
        return this;
    }

    public List<QueueEvent> events() {
        ArgumentCaptor<QueueEvent> captor = ArgumentCaptor.forClass(QueueEvent.class);
        verify(emitter, atLeast(0)).emit(captor.capture());
        return captor.getAllValues();
    }

    public List<QueueEvent> events(QueueEventType type) {
        return events().stream().filter(e -> e.type() == type).toList();
    }

    public static QueueConfig defaultConfig() {
        QueueConfig config = new QueueConfig();
        config.setReservationTtlMinutes(15);
        config.setWarningLeadMinutes(5);
        config.setMaxExtensions(1);
        config.setExtensionMinutes(10);
        config.setMinimumWaitMinutes(5);
        config.setDefaultMaxQueueLength(5);
        config.setDefaultAverageUsageMinutes(45);
        config.setTimerBatchSize(100);
        config.setTimerRetryBaseSeconds(5);
        config.setTimerRetryMaxSeconds(300);
        return config;
    }
}
