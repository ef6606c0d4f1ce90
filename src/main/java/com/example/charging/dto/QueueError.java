package com.example.charging.dto;

public enum QueueError {
    RESOURCE_UNAVAILABLE("err.resource_unavailable"),
    QUEUE_FULL("err.queue_full"),
    ALREADY_QUEUED("err.already_queued"),
    NOT_ELIGIBLE("err.not_eligible"),
    NO_ACTIVE_RESERVATION("err.no_active_reservation"),
    NOT_FOUND("err.not_found"),
    CONCURRENCY_CONFLICT("err.concurrency_conflict");

    private final String messageKey;

    QueueError(String messageKey) {
        this.messageKey = messageKey;
    }

    public String messageKey() {
        return messageKey;
    }
}
