package com.example.charging.dto;

import java.util.Objects;

/**
 * Outcome of a coordinator operation: either a value or a {@link QueueError}, never both.
 */
public record QueueResult<T>(T value, QueueError error) {

    public QueueResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
    }

    public static <T> QueueResult<T> ok(T value) {
        return new QueueResult<>(Objects.requireNonNull(value), null);
    }

    public static <T> QueueResult<T> failure(QueueError error) {
        return new QueueResult<>(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
