package com.example.charging.service;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import com.example.charging.model.ReservationTimer;
import com.example.charging.support.QueueFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ReservationTimerSweeperTest {

    private static final LocalDateTime T0 = LocalDateTime.ofInstant(QueueFixture.START, ZoneOffset.UTC);

    private QueueFixture fx;
    private ReservationTimerHandler handler;
    private ReservationTimerSweeper sweeper;
    private ReservationTimer expiry;

    @BeforeEach
    void setUp() {
        fx = new QueueFixture().station(5, 30);
        handler = Mockito.mock(ReservationTimerHandler.class);
        sweeper = new ReservationTimerSweeper(fx.store, handler, fx.timers, fx.locks, fx.tx, fx.config, fx.clock);

        QueueEntry entry = fx.store.saveEntry(QueueEntry.builder()
                .userId("u1")
                .resourceId(3L)
                .position(1)
                .status(QueueStatus.RESERVED)
                .reservationExpiry(T0.plusMinutes(2))
                .createdAt(T0)
                .updatedAt(T0)
                .joinedAt(T0)
                .build());
        fx.timers.arm(entry, T0);
        expiry = fx.store.findTimers(entry.getId()).get(0);
    }

    @Test
    void shouldSkipTimersNotYetDue() {
        sweeper.sweep();

        verify(handler, never()).onTimerDue(any());
    }

    @Test
    void shouldHandDueTimerToHandler() {
        fx.clock.advance(Duration.ofMinutes(2));

        sweeper.sweep();

        verify(handler).onTimerDue(expiry);
    }

    @Test
    void shouldRescheduleFailedTimerWithBackoff() {
        doThrow(new IllegalStateException("db hiccup")).when(handler).onTimerDue(any());
        fx.clock.advance(Duration.ofMinutes(2));
        LocalDateTime now = T0.plusMinutes(2);

        sweeper.sweep();

        ReservationTimer retried = fx.store.findTimer(expiry.getId()).orElseThrow();
        assertThat(retried.getAttempts()).isEqualTo(1);
        assertThat(retried.getDueAt()).isEqualTo(now.plusSeconds(5));
        assertThat(retried.getFireAt()).isEqualTo(T0.plusMinutes(2));

        sweeper.sweep();
        verify(handler, times(1)).onTimerDue(any());

        fx.clock.advance(Duration.ofSeconds(5));
        sweeper.sweep();

        ReservationTimer again = fx.store.findTimer(expiry.getId()).orElseThrow();
        assertThat(again.getAttempts()).isEqualTo(2);
        assertThat(again.getDueAt()).isEqualTo(now.plusSeconds(5).plusSeconds(10));
    }

    @Test
    void shouldKeepSweepingAfterOneTimerFails() {
        QueueEntry other = fx.store.saveEntry(QueueEntry.builder()
                .userId("u2")
                .resourceId(4L)
                .position(1)
                .status(QueueStatus.RESERVED)
                .reservationExpiry(T0.plusMinutes(2))
                .createdAt(T0)
                .updatedAt(T0)
                .joinedAt(T0)
                .build());
        fx.timers.arm(other, T0);
        ReservationTimer otherTimer = fx.store.findTimers(other.getId()).get(0);
        doThrow(new IllegalStateException("boom")).when(handler).onTimerDue(expiry);
        fx.clock.advance(Duration.ofMinutes(2));

        sweeper.sweep();

        verify(handler).onTimerDue(otherTimer);
    }
}
