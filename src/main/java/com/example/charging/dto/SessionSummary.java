package com.example.charging.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Raw session bounds; cost and energy are derived by the caller. */
public record SessionSummary(Long sessionId,
                             LocalDateTime startedAt,
                             LocalDateTime endedAt,
                             BigDecimal startMeterReading,
                             BigDecimal endMeterReading) {}
