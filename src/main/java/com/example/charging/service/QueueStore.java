package com.example.charging.service;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.ReservationTimer;
import com.example.charging.model.UsageSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Single source of truth for queue entries, usage sessions and armed reservation timers.
 * Callers re-read occupancy on every operation; nothing here is cached.
 */
public interface QueueStore {

    Optional<QueueEntry> findEntry(Long entryId);

    /** The row for the (user, resource) pair, terminal or not. */
    Optional<QueueEntry> findEntry(String userId, Long resourceId);

    /** WAITING and RESERVED entries of the resource, ordered by position. */
    List<QueueEntry> findQueuedEntries(Long resourceId);

    /** Non-terminal entries of the user across all resources, newest first. */
    List<QueueEntry> findActiveEntries(String userId);

    List<QueueEntry> findEntriesJoinedSince(Long resourceId, LocalDateTime since);

    QueueEntry saveEntry(QueueEntry entry);

    Optional<UsageSession> findOpenSession(Long entryId);

    UsageSession saveSession(UsageSession session);

    Optional<ReservationTimer> findTimer(Long timerId);

    List<ReservationTimer> findTimers(Long entryId);

    /** Timers with dueAt at or before {@code now}, earliest first. */
    List<ReservationTimer> findDueTimers(LocalDateTime now, int limit);

    ReservationTimer saveTimer(ReservationTimer timer);

    void deleteTimer(Long timerId);

    void deleteTimers(Long entryId);
}
