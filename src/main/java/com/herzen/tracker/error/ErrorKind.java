package com.herzen.tracker.error;

public enum ErrorKind {
    CYCLE_DETECTED,
    INVALID_TRANSITION,
    TASK_NOT_FOUND,
    DEPENDENCY_NOT_FOUND,
    DUPLICATE_DEPENDENCY,
    BLOCKED_CLOSURE,
    VALIDATION_REQUIRED
}
