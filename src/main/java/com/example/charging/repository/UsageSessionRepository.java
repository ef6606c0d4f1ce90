package com.example.charging.repository;

import com.example.charging.model.UsageSession;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UsageSessionRepository extends JpaRepository<UsageSession, Long> {

    Optional<UsageSession> findFirstByQueueEntryIdAndEndedAtIsNull(Long queueEntryId);
}
