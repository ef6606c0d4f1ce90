package com.example.charging.service;

/**
 * Ids of the timer pair armed for one reservation. {@code warningTimerId} is null when the
 * warning moment had already passed at arming time.
 */
public record TimerHandle(Long entryId, Long warningTimerId, Long expiryTimerId) {}
