package com.example.charging.controllers;

import com.example.charging.dto.ErrorResponse;
import com.example.charging.dto.JoinResult;
import com.example.charging.dto.QueueCommand;
import com.example.charging.dto.QueueEntryDTO;
import com.example.charging.dto.QueueError;
import com.example.charging.dto.QueueResult;
import com.example.charging.dto.QueueStatsDTO;
import com.example.charging.dto.SessionStarted;
import com.example.charging.dto.SessionSummary;
import com.example.charging.model.LeaveReason;
import com.example.charging.service.QueueCommandDispatcher;
import com.example.charging.service.QueueCommandParser;
import com.example.charging.service.QueueCoordinator;
import com.example.charging.service.util.Msg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
@Slf4j
public class QueueController {

    static final String USER_HEADER = "X-User-Id";

    private final QueueCoordinator coordinator;
    private final QueueCommandParser parser;
    private final QueueCommandDispatcher dispatcher;
    private final Msg msg;

    @PostMapping("/stations/{resourceId}/join")
    public ResponseEntity<?> join(@PathVariable Long resourceId,
                                  @RequestHeader(USER_HEADER) String userId,
                                  Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        QueueResult<JoinResult> result = coordinator.join(userId, resourceId);
        return respond(result, locale);
    }

    @PostMapping("/stations/{resourceId}/leave")
    public ResponseEntity<?> leave(@PathVariable Long resourceId,
                                   @RequestHeader(USER_HEADER) String userId,
                                   @RequestParam(defaultValue = "USER_CANCELLED") LeaveReason reason,
                                   Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        return respond(coordinator.leave(userId, resourceId, reason), locale);
    }

    @PostMapping("/stations/{resourceId}/reserve")
    public ResponseEntity<?> reserve(@PathVariable Long resourceId,
                                     @RequestHeader(USER_HEADER) String userId,
                                     @RequestParam(defaultValue = "0") int ttlMinutes,
                                     Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        return respond(coordinator.reserve(userId, resourceId, ttlMinutes), locale);
    }

    @PostMapping("/stations/{resourceId}/extend")
    public ResponseEntity<?> extend(@PathVariable Long resourceId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        return respond(coordinator.extendReservation(userId, resourceId), locale);
    }

    @PostMapping("/stations/{resourceId}/session/start")
    public ResponseEntity<?> startSession(@PathVariable Long resourceId,
                                          @RequestHeader(USER_HEADER) String userId,
                                          @RequestParam(required = false) BigDecimal meter,
                                          Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        QueueResult<SessionStarted> result = coordinator.startSession(userId, resourceId, meter);
        return respond(result, locale);
    }

    @PostMapping("/stations/{resourceId}/session/stop")
    public ResponseEntity<?> stopSession(@PathVariable Long resourceId,
                                         @RequestHeader(USER_HEADER) String userId,
                                         @RequestParam(required = false) BigDecimal meter,
                                         Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        QueueResult<SessionSummary> result = coordinator.stopSession(userId, resourceId, meter);
        return respond(result, locale);
    }

    @GetMapping("/stations/{resourceId}/status")
    public ResponseEntity<?> status(@PathVariable Long resourceId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        Optional<QueueEntryDTO> entry = coordinator.getStatus(userId, resourceId);
        if (entry.isEmpty()) {
            return error(QueueError.NOT_FOUND, locale);
        }
        return ResponseEntity.ok(entry.get());
    }

    @GetMapping("/stations/{resourceId}/stats")
    public ResponseEntity<QueueStatsDTO> stats(@PathVariable Long resourceId) {
        return ResponseEntity.ok(coordinator.getQueueStats(resourceId));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<?> userQueues(@PathVariable String userId, Locale locale) {
        if (!parser.isValidUserId(userId)) {
            return badUserId(userId, locale);
        }
        return ResponseEntity.ok(coordinator.getUserQueues(userId));
    }

    /** Button press from a chat front-end, e.g. {@code RESERVE:12:380501112233:15}. */
    @PostMapping("/commands")
    public ResponseEntity<?> command(@RequestBody String raw, Locale locale) {
        Optional<QueueCommand> command = parser.parse(raw);
        if (command.isEmpty()) {
            log.warn("Malformed queue command: '{}'", raw);
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("BAD_COMMAND", msg.get("err.bad_command", locale)));
        }
        return respond(dispatcher.dispatch(command.get()), locale);
    }

    private ResponseEntity<ErrorResponse> badUserId(String userId, Locale locale) {
        log.warn("Rejected malformed user id '{}'", userId);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_USER_ID", msg.get("err.bad_user_id", locale)));
    }

    private ResponseEntity<?> respond(QueueResult<?> result, Locale locale) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result.value());
        }
        return error(result.error(), locale);
    }

    private ResponseEntity<ErrorResponse> error(QueueError error, Locale locale) {
        return ResponseEntity.status(statusOf(error))
                .body(new ErrorResponse(error.name(), msg.get(error.messageKey(), locale)));
    }

    static HttpStatus statusOf(QueueError error) {
        return switch (error) {
            case NOT_FOUND, NO_ACTIVE_RESERVATION -> HttpStatus.NOT_FOUND;
            case QUEUE_FULL, ALREADY_QUEUED, NOT_ELIGIBLE, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case RESOURCE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
