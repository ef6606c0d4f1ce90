package com.example.charging.service;

import com.example.charging.model.ReservationTimer;

public interface ReservationTimerHandler {

    /**
     * Processes a due timer. Throws when processing failed and the timer must be retried.
     */
    void onTimerDue(ReservationTimer timer);
}
