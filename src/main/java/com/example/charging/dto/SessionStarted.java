package com.example.charging.dto;

import java.time.LocalDateTime;

public record SessionStarted(Long sessionId, LocalDateTime startedAt) {}
