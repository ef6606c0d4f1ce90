package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class QueueOperationException extends RuntimeException {

    private final QueueError error;

    public QueueOperationException(QueueError error, String message) {
        super(message);
        this.error = error;
    }

    public QueueError getError() {
        return error;
    }
}
