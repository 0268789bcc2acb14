package com.herzen.tracker.domain;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

public class DomainModels {
    public enum TaskType { PROJECT, EPIC, TASK, SUBTASK }

    public enum TaskStatus { OPEN, IN_PROGRESS, BLOCKED, CLOSED }

    public enum DependencyType {
        BLOCKS, PARENT_CHILD, RELATED;

        public static final Set<DependencyType> BLOCKING = EnumSet.of(BLOCKS, PARENT_CHILD);

        public boolean isBlocking() {
            return BLOCKING.contains(this);
        }
    }

    /**
     * Template-layer work item. Shared by every learner and read-only to the engine.
     */
    public record Task(String id,
                       String parentId,
                       String projectId,
                       String title,
                       TaskType type,
                       int priority,
                       Instant createdAt) {}

    /**
     * Directed edge: {@code taskId} depends on {@code dependsOnId}. For PARENT_CHILD the
     * task is the child and the dependency its parent.
     */
    public record Dependency(String taskId,
                             String dependsOnId,
                             DependencyType type,
                             Instant createdAt,
                             String createdBy) {}

    public record ProgressRecord(String taskId,
                                 String learnerId,
                                 TaskStatus status,
                                 Instant startedAt,
                                 Instant completedAt,
                                 String closeReason,
                                 Instant updatedAt,
                                 boolean persisted) {}

    public record ProgressEvent(String taskId,
                                String learnerId,
                                TaskStatus fromStatus,
                                TaskStatus toStatus,
                                String note,
                                Instant ts) {}

    public record ValidationOutcome(String taskId, String learnerId, boolean passed, String message, Instant validatedAt) {}
}
