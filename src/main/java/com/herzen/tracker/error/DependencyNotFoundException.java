package com.herzen.tracker.error;

import com.herzen.tracker.domain.DomainModels.DependencyType;

import java.util.Map;

public class DependencyNotFoundException extends TrackerException {
    private final String taskId;
    private final String dependsOnId;
    private final DependencyType type;

    public DependencyNotFoundException(String taskId, String dependsOnId, DependencyType type) {
        super(ErrorKind.DEPENDENCY_NOT_FOUND, "Dependency " + taskId + " -> " + dependsOnId + " (" + type + ") does not exist");
        this.taskId = taskId;
        this.dependsOnId = dependsOnId;
        this.type = type;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId, "dependsOnId", dependsOnId, "type", type);
    }
}
