package com.example.charging.dto;

public record JoinResult(Long entryId, int position, int estimatedWaitMinutes) {}
