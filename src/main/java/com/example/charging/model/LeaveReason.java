package com.example.charging.model;

public enum LeaveReason {
    USER_CANCELLED, EXPIRED, COMPLETED;

    public QueueStatus targetStatus() {
        return this == COMPLETED ? QueueStatus.COMPLETED : QueueStatus.CANCELLED;
    }
}
