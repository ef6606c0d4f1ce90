package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class QueueFullException extends QueueOperationException {
    public QueueFullException(String message) {
        super(QueueError.QUEUE_FULL, message);
    }
}
