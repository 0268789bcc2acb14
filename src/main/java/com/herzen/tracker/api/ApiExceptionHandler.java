package com.herzen.tracker.api;

import com.herzen.tracker.error.ErrorKind;
import com.herzen.tracker.error.TrackerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TrackerException.class)
    public ResponseEntity<ErrorResponse> handleTracker(TrackerException e) {
        return ResponseEntity.status(statusOf(e.kind()))
                .body(new ErrorResponse(e.kind().name(), e.getMessage(), e.details()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage(), Map.of()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case TASK_NOT_FOUND, DEPENDENCY_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CYCLE_DETECTED, DUPLICATE_DEPENDENCY, INVALID_TRANSITION, BLOCKED_CLOSURE -> HttpStatus.CONFLICT;
            case VALIDATION_REQUIRED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    public record ErrorResponse(String kind, String message, Map<String, Object> details) {}
}
