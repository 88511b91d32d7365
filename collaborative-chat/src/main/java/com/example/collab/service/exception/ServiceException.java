package com.example.collab.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final FailureReason reason;

    public ServiceException(FailureReason reason) {
        this(reason, reason.getDefaultMessage(), null);
    }

    public ServiceException(FailureReason reason, String message) {
        this(reason, message, null);
    }

    public ServiceException(FailureReason reason, String message, Throwable cause) {
        super(message, cause, false, reason.getStatus().is5xxServerError());
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    public HttpStatus getStatus() {
        return reason.getStatus();
    }

    public ErrorCategory getCategory() {
        return reason.getCategory();
    }

    public String getErrorCode() {
        return reason.code();
    }
}
