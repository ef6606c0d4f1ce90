package com.example.charging.service;

import java.util.function.Supplier;

public interface TxRunner {

    <T> T required(Supplier<T> body);

    default void required(Runnable body) {
        required(() -> {
            body.run();
            return null;
        });
    }
}
