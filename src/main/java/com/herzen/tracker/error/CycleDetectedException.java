package com.herzen.tracker.error;

import com.herzen.tracker.domain.DomainModels.DependencyType;

import java.util.List;
import java.util.Map;

public class CycleDetectedException extends TrackerException {
    private final String taskId;
    private final String dependsOnId;
    private final DependencyType type;
    private final List<String> path;

    public CycleDetectedException(String taskId, String dependsOnId, DependencyType type, List<String> path, String message) {
        super(ErrorKind.CYCLE_DETECTED, message);
        this.taskId = taskId;
        this.dependsOnId = dependsOnId;
        this.type = type;
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId, "dependsOnId", dependsOnId, "type", type, "path", path);
    }
}
