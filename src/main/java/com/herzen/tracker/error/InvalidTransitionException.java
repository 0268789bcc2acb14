package com.herzen.tracker.error;

import com.herzen.tracker.domain.DomainModels.TaskStatus;

import java.util.Map;

public class InvalidTransitionException extends TrackerException {
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(TaskStatus from, TaskStatus to, String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(TaskStatus from, TaskStatus to) {
        this(from, to, "Cannot transition from " + from + " to " + to);
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("from", from, "to", to);
    }
}
