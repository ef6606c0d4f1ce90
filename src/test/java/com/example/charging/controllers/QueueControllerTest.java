package com.example.charging.controllers;

import com.example.charging.dto.ErrorResponse;
import com.example.charging.dto.JoinResult;
import com.example.charging.dto.QueueError;
import com.example.charging.dto.QueueResult;
import com.example.charging.dto.QueueStatsDTO;
import com.example.charging.model.LeaveReason;
import com.example.charging.service.QueueCommandDispatcher;
import com.example.charging.service.QueueCommandParser;
import com.example.charging.service.QueueCoordinator;
import com.example.charging.service.util.Msg;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueControllerTest {

    private QueueCoordinator coordinator;
    private QueueController controller;

    @BeforeEach
    void setUp() {
        coordinator = Mockito.mock(QueueCoordinator.class);
        ResourceBundleMessageSource messages = new ResourceBundleMessageSource();
        messages.setBasename("messages");
        messages.setDefaultEncoding("UTF-8");
        messages.setFallbackToSystemLocale(false);
        controller = new QueueController(coordinator, new QueueCommandParser(),
                new QueueCommandDispatcher(coordinator), new Msg(messages));
    }

    @Test
    void shouldReturnJoinResult() {
        when(coordinator.join("u1", 12L)).thenReturn(QueueResult.ok(new JoinResult(3L, 1, 5)));

        ResponseEntity<?> response = controller.join(12L, "u1", Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(new JoinResult(3L, 1, 5));
    }

    @Test
    void shouldMapQueueFullToConflict() {
        when(coordinator.join("u1", 12L)).thenReturn(QueueResult.failure(QueueError.QUEUE_FULL));

        ResponseEntity<?> response = controller.join(12L, "u1", Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isEqualTo(
                new ErrorResponse("QUEUE_FULL", "The queue for this station is full."));
    }

    @Test
    void shouldLocalizeErrorMessage() {
        when(coordinator.leave("u1", 12L, LeaveReason.USER_CANCELLED)).thenReturn(QueueResult.failure(QueueError.NOT_FOUND));

        ResponseEntity<?> response = controller.leave(12L, "u1", LeaveReason.USER_CANCELLED, new Locale("uk"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(((ErrorResponse) response.getBody()).message()).isEqualTo("Запис у черзі не знайдено.");
    }

    @Test
    void shouldMapEveryErrorToStatus() {
        assertThat(QueueController.statusOf(QueueError.RESOURCE_UNAVAILABLE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(QueueController.statusOf(QueueError.NO_ACTIVE_RESERVATION)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(QueueController.statusOf(QueueError.ALREADY_QUEUED)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(QueueController.statusOf(QueueError.NOT_ELIGIBLE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(QueueController.statusOf(QueueError.CONCURRENCY_CONFLICT)).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void shouldReturnNotFoundForMissingStatus() {
        when(coordinator.getStatus("u1", 12L)).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.status(12L, "u1", Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void shouldServeStatsAndUserQueues() {
        QueueStatsDTO stats = new QueueStatsDTO(12L, 2, 40, List.of("18:00-19:00"));
        when(coordinator.getQueueStats(12L)).thenReturn(stats);
        when(coordinator.getUserQueues("u1")).thenReturn(List.of());

        assertThat(controller.stats(12L).getBody()).isEqualTo(stats);
        assertThat(controller.userQueues("u1", Locale.ENGLISH).getBody()).isEqualTo(List.of());
    }

    @Test
    void shouldRejectOverlongUserIdBeforeTouchingQueue() {
        String userId = "u".repeat(40);

        ResponseEntity<?> response = controller.join(12L, userId, Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(
                new ErrorResponse("BAD_USER_ID", "The user id is missing or malformed."));
        verify(coordinator, never()).join(any(), any());
    }

    @Test
    void shouldRejectUserIdWithSeparators() {
        assertThat(controller.reserve(12L, "u1:42", 15, Locale.ENGLISH).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.userQueues("bad user", Locale.ENGLISH).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(coordinator, never()).reserve(any(), any(), Mockito.anyInt());
    }

    @Test
    void shouldDispatchEncodedCommand() {
        when(coordinator.reserve("u1", 12L, 20)).thenReturn(QueueResult.ok(true));

        ResponseEntity<?> response = controller.command("RESERVE:12:u1:20", Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(true);
    }

    @Test
    void shouldRejectMalformedCommand() {
        ResponseEntity<?> response = controller.command("RESERVE:twelve", Locale.ENGLISH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).error()).isEqualTo("BAD_COMMAND");
        verify(coordinator, never()).reserve(any(), any(), Mockito.anyInt());
    }
}
