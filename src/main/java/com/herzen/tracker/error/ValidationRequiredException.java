package com.herzen.tracker.error;

import java.util.Map;

public class ValidationRequiredException extends TrackerException {
    private final String taskId;
    private final String reason;

    public ValidationRequiredException(String taskId, String reason) {
        super(ErrorKind.VALIDATION_REQUIRED, "Cannot close task " + taskId + ": " + reason);
        this.taskId = taskId;
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId, "reason", reason == null ? "" : reason);
    }
}
