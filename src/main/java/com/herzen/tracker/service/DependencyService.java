package com.herzen.tracker.service;

import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.error.CycleDetectedException;
import com.herzen.tracker.error.DependencyNotFoundException;
import com.herzen.tracker.error.DuplicateDependencyException;
import com.herzen.tracker.graph.CycleGuard;
import com.herzen.tracker.graph.TaskGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class DependencyService {
    private static final Logger log = LoggerFactory.getLogger(DependencyService.class);
    private static final String DEFAULT_ACTOR = "system";

    private final TaskGraphStore graphStore;
    private final CycleGuard cycleGuard;
    private final ProjectGraphLock graphLock;

    public DependencyService(TaskGraphStore graphStore, CycleGuard cycleGuard, ProjectGraphLock graphLock) {
        this.graphStore = graphStore;
        this.cycleGuard = cycleGuard;
        this.graphLock = graphLock;
    }

    public Dependency addDependency(String taskId, String dependsOnId, DependencyType type) {
        return addDependency(taskId, dependsOnId, type, null);
    }

    /**
     * Inserts {@code taskId -> dependsOnId}. Blocking edges are checked for cycles while both
     * projects are locked, so the check and the insert cannot interleave with another writer.
     */
    public Dependency addDependency(String taskId, String dependsOnId, DependencyType type, String createdBy) {
        if (type == null) {
            throw new IllegalArgumentException("Dependency type is required");
        }
        Task task = graphStore.getTask(taskId);
        Task dependsOn = graphStore.getTask(dependsOnId);

        return graphLock.withProjects(List.of(task.projectId(), dependsOn.projectId()), () -> {
            if (graphStore.edgeExists(taskId, dependsOnId, type)) {
                throw new DuplicateDependencyException(taskId, dependsOnId, type);
            }
            if (type.isBlocking()) {
                rejectCycle(taskId, dependsOnId, type);
            }
            String actor = createdBy == null || createdBy.isBlank() ? DEFAULT_ACTOR : createdBy;
            Dependency dependency = new Dependency(taskId, dependsOnId, type, Instant.now(), actor);
            graphStore.addEdge(dependency);
            log.info("Added dependency {} -> {} ({})", taskId, dependsOnId, type);
            return dependency;
        });
    }

    public void removeDependency(String taskId, String dependsOnId, DependencyType type) {
        if (type == null) {
            throw new IllegalArgumentException("Dependency type is required");
        }
        Task task = graphStore.getTask(taskId);
        Task dependsOn = graphStore.getTask(dependsOnId);
        graphLock.withProjects(List.of(task.projectId(), dependsOn.projectId()), () -> {
            if (!graphStore.removeEdge(taskId, dependsOnId, type)) {
                throw new DependencyNotFoundException(taskId, dependsOnId, type);
            }
            return null;
        });
        log.info("Removed dependency {} -> {} ({})", taskId, dependsOnId, type);
    }

    public List<Dependency> getDependencies(String taskId, DependencyType typeFilter) {
        graphStore.getTask(taskId);
        return graphStore.dependenciesOf(taskId, typeFilter);
    }

    public List<Dependency> getDependents(String taskId, DependencyType typeFilter) {
        graphStore.getTask(taskId);
        return graphStore.dependentsOf(taskId, typeFilter);
    }

    private void rejectCycle(String taskId, String dependsOnId, DependencyType type) {
        Optional<List<String>> path = cycleGuard.findClosingPath(taskId, dependsOnId);
        if (path.isPresent()) {
            log.debug("Rejected {} -> {} ({}): cycle {}", taskId, dependsOnId, type, path.get());
            throw new CycleDetectedException(taskId, dependsOnId, type, path.get(),
                    "Adding " + taskId + " -> " + dependsOnId + " would create cycle " + String.join(" -> ", path.get()));
        }
        // a task waiting on its own ancestor can never close: the ancestor waits for it first
        if (type == DependencyType.BLOCKS && cycleGuard.isAncestor(dependsOnId, taskId)) {
            List<String> closure = List.of(taskId, dependsOnId, taskId);
            throw new CycleDetectedException(taskId, dependsOnId, type, closure,
                    "Task " + taskId + " cannot wait on its ancestor " + dependsOnId);
        }
        if (type == DependencyType.PARENT_CHILD) {
            Optional<List<String>> deadlock = cycleGuard.findAncestorDeadlock(taskId, dependsOnId);
            if (deadlock.isPresent()) {
                List<String> closure = deadlock.get();
                throw new CycleDetectedException(taskId, dependsOnId, type, closure,
                        "Making " + dependsOnId + " a parent of " + taskId + " would leave " + closure.get(0)
                                + " waiting on its ancestor " + closure.get(1));
            }
        }
    }
}
