package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class NotEligibleException extends QueueOperationException {
    public NotEligibleException(String message) {
        super(QueueError.NOT_ELIGIBLE, message);
    }
}
