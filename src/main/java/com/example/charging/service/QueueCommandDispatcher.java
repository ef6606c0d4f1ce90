package com.example.charging.service;

import com.example.charging.dto.QueueCommand;
import com.example.charging.dto.QueueError;
import com.example.charging.dto.QueueResult;
import com.example.charging.model.LeaveReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/** Routes a decoded {@link QueueCommand} to the coordinator. */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueCommandDispatcher {

    private final QueueCoordinator coordinator;

    public QueueResult<?> dispatch(QueueCommand command) {
        log.debug("Dispatching {} for user {} on station {}", command.action(), command.userId(), command.resourceId());

        String userId = command.userId();
        Long resourceId = command.resourceId();
        String extra = command.extra();

        return switch (command.action()) {
            case JOIN -> coordinator.join(userId, resourceId);
            case LEAVE -> coordinator.leave(userId, resourceId,
                    extra == null ? LeaveReason.USER_CANCELLED : QueueCommandParser.leaveReason(extra));
            case RESERVE -> coordinator.reserve(userId, resourceId, extra == null ? 0 : Integer.parseInt(extra));
            case EXTEND -> coordinator.extendReservation(userId, resourceId);
            case START_SESSION -> coordinator.startSession(userId, resourceId, extra == null ? null : new BigDecimal(extra));
            case STOP_SESSION -> coordinator.stopSession(userId, resourceId, extra == null ? null : new BigDecimal(extra));
            case STATUS -> coordinator.getStatus(userId, resourceId)
                    .<QueueResult<?>>map(QueueResult::ok)
                    .orElseGet(() -> QueueResult.failure(QueueError.NOT_FOUND));
        };
    }
}
