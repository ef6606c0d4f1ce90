package com.example.charging.dto;

public record ErrorResponse(String error, String message) {}
