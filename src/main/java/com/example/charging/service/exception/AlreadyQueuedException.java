package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class AlreadyQueuedException extends QueueOperationException {
    public AlreadyQueuedException(String message) {
        super(QueueError.ALREADY_QUEUED, message);
    }
}
