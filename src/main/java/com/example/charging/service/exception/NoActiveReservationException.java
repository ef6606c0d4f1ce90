package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class NoActiveReservationException extends QueueOperationException {
    public NoActiveReservationException(String message) {
        super(QueueError.NO_ACTIVE_RESERVATION, message);
    }
}
