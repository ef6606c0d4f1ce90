package com.example.charging.service.impl;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import com.example.charging.model.ReservationTimer;
import com.example.charging.model.UsageSession;
import com.example.charging.repository.QueueEntryRepository;
import com.example.charging.repository.ReservationTimerRepository;
import com.example.charging.repository.UsageSessionRepository;
import com.example.charging.service.QueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "queue.store", havingValue = "jpa", matchIfMissing = true)
public class JpaQueueStore implements QueueStore {

    private static final Set<QueueStatus> QUEUED = EnumSet.of(QueueStatus.WAITING, QueueStatus.RESERVED);
    private static final Set<QueueStatus> ACTIVE = EnumSet.of(QueueStatus.WAITING, QueueStatus.RESERVED, QueueStatus.CHARGING);

    private final QueueEntryRepository entryRepo;
    private final UsageSessionRepository sessionRepo;
    private final ReservationTimerRepository timerRepo;

    @Override
    public Optional<QueueEntry> findEntry(Long entryId) {
        return entryRepo.findById(entryId);
    }

    @Override
    public Optional<QueueEntry> findEntry(String userId, Long resourceId) {
        return entryRepo.findFirstByUserIdAndResourceIdOrderByUpdatedAtDesc(userId, resourceId);
    }

    @Override
    public List<QueueEntry> findQueuedEntries(Long resourceId) {
        return entryRepo.findByResourceIdAndStatusInOrderByPositionAsc(resourceId, QUEUED);
    }

    @Override
    public List<QueueEntry> findActiveEntries(String userId) {
        return entryRepo.findByUserIdAndStatusInOrderByJoinedAtDesc(userId, ACTIVE);
    }

    @Override
    public List<QueueEntry> findEntriesJoinedSince(Long resourceId, LocalDateTime since) {
        return entryRepo.findByResourceIdAndJoinedAtAfter(resourceId, since);
    }

    @Override
    public QueueEntry saveEntry(QueueEntry entry) {
        // flush so version clashes surface inside the operation that caused them
        return entryRepo.saveAndFlush(entry);
    }

    @Override
    public Optional<UsageSession> findOpenSession(Long entryId) {
        return sessionRepo.findFirstByQueueEntryIdAndEndedAtIsNull(entryId);
    }

    @Override
    public UsageSession saveSession(UsageSession session) {
        return sessionRepo.save(session);
    }

    @Override
    public Optional<ReservationTimer> findTimer(Long timerId) {
        return timerRepo.findById(timerId);
    }

    @Override
    public List<ReservationTimer> findTimers(Long entryId) {
        return timerRepo.findByQueueEntryId(entryId);
    }

    @Override
    public List<ReservationTimer> findDueTimers(LocalDateTime now, int limit) {
        return timerRepo.findDue(now, PageRequest.of(0, limit));
    }

    @Override
    public ReservationTimer saveTimer(ReservationTimer timer) {
        return timerRepo.save(timer);
    }

    @Override
    public void deleteTimer(Long timerId) {
        timerRepo.findById(timerId).ifPresent(timerRepo::delete);
    }

    @Override
    public void deleteTimers(Long entryId) {
        List<ReservationTimer> armed = timerRepo.findByQueueEntryId(entryId);
        timerRepo.deleteAll(armed);
        log.debug("Removed {} timers of entry {}", armed.size(), entryId);
    }
}
