package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class QueueEntryNotFoundException extends QueueOperationException {
    public QueueEntryNotFoundException(String message) {
        super(QueueError.NOT_FOUND, message);
    }
}
