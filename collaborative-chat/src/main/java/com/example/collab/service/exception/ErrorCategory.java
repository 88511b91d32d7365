package com.example.collab.service.exception;

public enum ErrorCategory {
    VALIDATION,
    AUTH,
    NOT_FOUND,
    CONFLICT,
    STATE,
    UNAVAILABLE
}
