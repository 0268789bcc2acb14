package com.herzen.tracker.error;

import com.herzen.tracker.domain.DomainModels.DependencyType;

import java.util.Map;

public class DuplicateDependencyException extends TrackerException {
    private final String taskId;
    private final String dependsOnId;
    private final DependencyType type;

    public DuplicateDependencyException(String taskId, String dependsOnId, DependencyType type) {
        super(ErrorKind.DUPLICATE_DEPENDENCY, "Dependency " + taskId + " -> " + dependsOnId + " (" + type + ") already exists");
        this.taskId = taskId;
        this.dependsOnId = dependsOnId;
        this.type = type;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId, "dependsOnId", dependsOnId, "type", type);
    }
}
