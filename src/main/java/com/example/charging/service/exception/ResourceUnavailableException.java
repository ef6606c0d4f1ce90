package com.example.charging.service.exception;

import com.example.charging.dto.QueueError;

public class ResourceUnavailableException extends QueueOperationException {
    public ResourceUnavailableException(String message) {
        super(QueueError.RESOURCE_UNAVAILABLE, message);
    }
}
