package com.example.charging.service.impl;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.ReservationTimer;
import com.example.charging.model.UsageSession;
import com.example.charging.service.QueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store. Entries are kept by reference, so writes are visible before
 * {@link #saveEntry} and are not rolled back on failure.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "queue.store", havingValue = "memory")
public class InMemoryQueueStore implements QueueStore {

    private final Map<Long, QueueEntry> entries = new ConcurrentHashMap<>();
    private final Map<Long, UsageSession> sessions = new ConcurrentHashMap<>();
    private final Map<Long, ReservationTimer> timers = new ConcurrentHashMap<>();

    private final AtomicLong entrySeq = new AtomicLong();
    private final AtomicLong sessionSeq = new AtomicLong();
    private final AtomicLong timerSeq = new AtomicLong();

    @Override
    public Optional<QueueEntry> findEntry(Long entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public Optional<QueueEntry> findEntry(String userId, Long resourceId) {
        return entries.values().stream()
                .filter(e -> e.getUserId().equals(userId) && e.getResourceId().equals(resourceId))
                .max(Comparator.comparing(QueueEntry::getUpdatedAt));
    }

    @Override
    public List<QueueEntry> findQueuedEntries(Long resourceId) {
        return entries.values().stream()
                .filter(e -> e.getResourceId().equals(resourceId) && e.isQueued())
                .sorted(Comparator.comparing(QueueEntry::getPosition))
                .toList();
    }

    @Override
    public List<QueueEntry> findActiveEntries(String userId) {
        return entries.values().stream()
                .filter(e -> e.getUserId().equals(userId) && e.isActive())
                .sorted(Comparator.comparing(QueueEntry::getJoinedAt).reversed())
                .toList();
    }

    @Override
    public List<QueueEntry> findEntriesJoinedSince(Long resourceId, LocalDateTime since) {
        return entries.values().stream()
                .filter(e -> e.getResourceId().equals(resourceId))
                .filter(e -> e.getJoinedAt() != null && e.getJoinedAt().isAfter(since))
                .toList();
    }

    @Override
    public QueueEntry saveEntry(QueueEntry entry) {
        if (entry.getId() == null) {
            entry.setId(entrySeq.incrementAndGet());
        }
        entries.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public Optional<UsageSession> findOpenSession(Long entryId) {
        return sessions.values().stream()
                .filter(s -> s.getQueueEntryId().equals(entryId) && s.isOpen())
                .findFirst();
    }

    @Override
    public UsageSession saveSession(UsageSession session) {
        if (session.getId() == null) {
            session.setId(sessionSeq.incrementAndGet());
        }
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public Optional<ReservationTimer> findTimer(Long timerId) {
        return Optional.ofNullable(timers.get(timerId));
    }

    @Override
    public List<ReservationTimer> findTimers(Long entryId) {
        return timers.values().stream()
                .filter(t -> Objects.equals(t.getQueueEntryId(), entryId))
                .toList();
    }

    @Override
    public List<ReservationTimer> findDueTimers(LocalDateTime now, int limit) {
        return timers.values().stream()
                .filter(t -> !t.getDueAt().isAfter(now))
                .sorted(Comparator.comparing(ReservationTimer::getDueAt))
                .limit(limit)
                .toList();
    }

    @Override
    public ReservationTimer saveTimer(ReservationTimer timer) {
        if (timer.getId() == null) {
            timer.setId(timerSeq.incrementAndGet());
        }
        timers.put(timer.getId(), timer);
        return timer;
    }

    @Override
    public void deleteTimer(Long timerId) {
        timers.remove(timerId);
    }

    @Override
    public void deleteTimers(Long entryId) {
        timers.values().removeIf(t -> Objects.equals(t.getQueueEntryId(), entryId));
        log.debug("Removed timers of entry {}", entryId);
    }
}
