package com.example.collab.controller;

import com.example.collab.service.exception.ErrorCategory;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceException(ServiceException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(body(ex.getMessage(), ex.getErrorCode(), ex.getCategory().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        Map<String, Object> payload = body("validation_error", "invalid_request", ErrorCategory.VALIDATION.name());
        payload.put("details", details);
        return ResponseEntity.badRequest().body(payload);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Rejected malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body("Malformed request", "invalid_request", ErrorCategory.VALIDATION.name()));
    }

    @ExceptionHandler({
        DataAccessResourceFailureException.class,
        CannotCreateTransactionException.class,
        QueryTimeoutException.class
    })
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(RuntimeException ex) {
        log.error("Store unavailable", ex);
        FailureReason reason = FailureReason.STORE_UNAVAILABLE;
        return ResponseEntity.status(reason.getStatus())
                .body(body(reason.getDefaultMessage(), reason.code(), reason.getCategory().name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("Internal error", "internal_error", null));
    }

    private Map<String, Object> body(String error, String code, String category) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("error", error);
        payload.put("code", code);
        if (category != null) {
            payload.put("category", category);
        }
        return payload;
    }
}
