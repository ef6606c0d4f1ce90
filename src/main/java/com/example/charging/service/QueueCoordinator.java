package com.example.charging.service;

import com.example.charging.dto.JoinResult;
import com.example.charging.dto.QueueEntryDTO;
import com.example.charging.dto.QueueResult;
import com.example.charging.dto.QueueStatsDTO;
import com.example.charging.dto.SessionStarted;
import com.example.charging.dto.SessionSummary;
import com.example.charging.model.LeaveReason;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the charging queue. Every operation is serialized per resource and
 * reports failures as values; none of them throws on a rejected request.
 */
public interface QueueCoordinator {

    QueueResult<JoinResult> join(String userId, Long resourceId);

    QueueResult<Boolean> leave(String userId, Long resourceId, LeaveReason reason);

    QueueResult<Boolean> reserve(String userId, Long resourceId, int ttlMinutes);

    QueueResult<Boolean> extendReservation(String userId, Long resourceId);

    QueueResult<SessionStarted> startSession(String userId, Long resourceId, BigDecimal startMeterReading);

    QueueResult<SessionSummary> stopSession(String userId, Long resourceId, BigDecimal endMeterReading);

    Optional<QueueEntryDTO> getStatus(String userId, Long resourceId);

    List<QueueEntryDTO> getUserQueues(String userId);

    QueueStatsDTO getQueueStats(Long resourceId);
}
