package com.example.charging.model;

public enum QueueStatus {
    WAITING, RESERVED, CHARGING, COMPLETED, CANCELLED;

    /** Non-terminal: the user still holds this entry. */
    public boolean isActive() {
        return this == WAITING || this == RESERVED || this == CHARGING;
    }

    /** Standing in line: counted for positions and queue length. */
    public boolean isQueued() {
        return this == WAITING || this == RESERVED;
    }
}
