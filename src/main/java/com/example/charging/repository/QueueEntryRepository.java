package com.example.charging.repository;

import com.example.charging.model.QueueEntry;
import com.example.charging.model.QueueStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface QueueEntryRepository extends JpaRepository<QueueEntry, Long> {

    Optional<QueueEntry> findFirstByUserIdAndResourceIdOrderByUpdatedAtDesc(String userId, Long resourceId);

    List<QueueEntry> findByResourceIdAndStatusInOrderByPositionAsc(Long resourceId, Collection<QueueStatus> statuses);

    List<QueueEntry> findByUserIdAndStatusInOrderByJoinedAtDesc(String userId, Collection<QueueStatus> statuses);

    List<QueueEntry> findByResourceIdAndJoinedAtAfter(Long resourceId, LocalDateTime since);
}
