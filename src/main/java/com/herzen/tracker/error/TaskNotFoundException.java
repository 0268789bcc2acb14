package com.herzen.tracker.error;

import java.util.Map;

public class TaskNotFoundException extends TrackerException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorKind.TASK_NOT_FOUND, "Task " + taskId + " does not exist");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId);
    }
}
