package com.example.charging.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueueEventType {
    JOINED,
    LEFT,
    RESERVED,
    PROMOTED,
    POSITION_UPDATED,
    RESERVATION_WARNING,
    RESERVATION_EXTENDED,
    EXPIRED,
    SESSION_STARTED,
    SESSION_COMPLETED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
