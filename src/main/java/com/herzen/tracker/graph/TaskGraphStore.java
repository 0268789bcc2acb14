package com.herzen.tracker.graph;

import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskType;
import com.herzen.tracker.error.TaskNotFoundException;
import com.herzen.tracker.graph.GraphModels.ProjectGraph;
import com.herzen.tracker.repository.DependencyJdbcRepository;
import com.herzen.tracker.repository.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Template graph of tasks and typed edges. Reads go straight to the indexed tables, except
 * {@link #projectGraph(String)} which may be served from a cache invalidated on every write.
 */
@Service
public class TaskGraphStore {
    private static final Logger log = LoggerFactory.getLogger(TaskGraphStore.class);

    private final TaskJdbcRepository taskRepository;
    private final DependencyJdbcRepository dependencyRepository;
    private final boolean cacheEnabled;
    private final Map<String, ProjectGraph> graphCache = new ConcurrentHashMap<>();
    private final Object cacheMonitor = new Object();
    private long generation;

    public TaskGraphStore(TaskJdbcRepository taskRepository,
                          DependencyJdbcRepository dependencyRepository,
                          @Value("${tracker.graph.cache-enabled:true}") boolean cacheEnabled) {
        this.taskRepository = taskRepository;
        this.dependencyRepository = dependencyRepository;
        this.cacheEnabled = cacheEnabled;
    }

    public Task addTask(Task task) {
        if (task.id() == null || task.id().isBlank()) {
            throw new IllegalArgumentException("Task id is required");
        }
        if (task.type() == null) {
            throw new IllegalArgumentException("Task type is required");
        }
        if (taskRepository.exists(task.id())) {
            throw new IllegalArgumentException("Task " + task.id() + " already exists");
        }
        if (task.priority() < 0 || task.priority() > 4) {
            throw new IllegalArgumentException("Priority must be between 0 and 4, got " + task.priority());
        }

        String projectId = task.projectId();
        if (task.parentId() != null) {
            Task parent = getTask(task.parentId());
            if (projectId == null) {
                projectId = parent.projectId();
            } else if (!projectId.equals(parent.projectId())) {
                throw new IllegalArgumentException("Parent " + parent.id() + " belongs to project " + parent.projectId());
            }
        }
        if (projectId == null) {
            if (task.type() != TaskType.PROJECT) {
                throw new IllegalArgumentException("Project id is required for " + task.type() + " " + task.id());
            }
            projectId = task.id();
        }

        Task stored = new Task(task.id(), task.parentId(), projectId, task.title(), task.type(), task.priority(),
                task.createdAt() == null ? Instant.now() : task.createdAt());
        taskRepository.insert(stored);
        invalidate(Set.of(projectId));
        log.info("Added {} {} to project {}", stored.type(), stored.id(), projectId);
        return stored;
    }

    public Task getTask(String taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Raw insert; cycle validation is the caller's job.
     */
    public void addEdge(Dependency dependency) {
        dependencyRepository.insert(dependency);
        invalidateAfterCommit(dependency.taskId(), dependency.dependsOnId());
    }

    public boolean removeEdge(String taskId, String dependsOnId, DependencyType type) {
        boolean removed = dependencyRepository.delete(taskId, dependsOnId, type) > 0;
        if (removed) {
            invalidateAfterCommit(taskId, dependsOnId);
        }
        return removed;
    }

    public boolean edgeExists(String taskId, String dependsOnId, DependencyType type) {
        return dependencyRepository.exists(taskId, dependsOnId, type);
    }

    public List<Dependency> dependenciesOf(String taskId, DependencyType typeFilter) {
        return dependencyRepository.findOutgoing(taskId, typeFilter);
    }

    public List<Dependency> dependentsOf(String taskId, DependencyType typeFilter) {
        return dependencyRepository.findIncoming(taskId, typeFilter);
    }

    public List<String> blockerIdsOf(String taskId) {
        return dependenciesOf(taskId, DependencyType.BLOCKS).stream().map(Dependency::dependsOnId).distinct().toList();
    }

    /**
     * Tree children plus tasks that declare an explicit PARENT_CHILD edge onto this one.
     */
    public List<Task> childrenOf(String taskId) {
        Map<String, Task> children = new TreeMap<>();
        taskRepository.findChildren(taskId).forEach(c -> children.put(c.id(), c));
        for (Dependency d : dependencyRepository.findIncoming(taskId, DependencyType.PARENT_CHILD)) {
            if (!children.containsKey(d.taskId())) {
                taskRepository.findById(d.taskId()).ifPresent(c -> children.put(c.id(), c));
            }
        }
        return List.copyOf(children.values());
    }

    /**
     * Tree parent first, then explicit PARENT_CHILD targets.
     */
    public List<String> parentIdsOf(String taskId) {
        List<String> parents = new ArrayList<>();
        taskRepository.findParentId(taskId).ifPresent(parents::add);
        dependenciesOf(taskId, DependencyType.PARENT_CHILD).stream()
                .map(Dependency::dependsOnId)
                .filter(p -> !parents.contains(p))
                .forEach(parents::add);
        return parents;
    }

    /**
     * Parent chain following tree links only, nearest first.
     */
    public List<Task> ancestorsOf(String taskId) {
        Task current = getTask(taskId);
        List<Task> ancestors = new ArrayList<>();
        Set<String> seen = new HashSet<>(Set.of(taskId));
        while (current.parentId() != null && seen.add(current.parentId())) {
            Optional<Task> parent = taskRepository.findById(current.parentId());
            if (parent.isEmpty()) break;
            ancestors.add(parent.get());
            current = parent.get();
        }
        return ancestors;
    }

    /**
     * Out-neighbours in the blocking subgraph, read fresh from the store: BLOCKS and explicit
     * PARENT_CHILD targets plus the tree parent.
     */
    public List<String> blockingSuccessors(String taskId) {
        LinkedHashSet<String> next = new LinkedHashSet<>(dependencyRepository.findBlockingTargets(taskId));
        taskRepository.findParentId(taskId).ifPresent(next::add);
        return List.copyOf(next);
    }

    public List<String> projectIds() {
        return taskRepository.findProjectIds();
    }

    public ProjectGraph projectGraph(String projectId) {
        if (!cacheEnabled) {
            return readProjectGraph(projectId);
        }
        ProjectGraph cached = graphCache.get(projectId);
        if (cached != null) return cached;

        long seenGeneration;
        synchronized (cacheMonitor) {
            seenGeneration = generation;
        }
        ProjectGraph loaded = readProjectGraph(projectId);
        synchronized (cacheMonitor) {
            if (generation == seenGeneration) {
                graphCache.put(projectId, loaded);
            }
        }
        return loaded;
    }

    /**
     * Uncached snapshot, for callers that must see every committed write.
     */
    public ProjectGraph readProjectGraph(String projectId) {
        return ProjectGraph.of(projectId, taskRepository.findByProject(projectId), dependencyRepository.findByProject(projectId));
    }

    private void invalidateAfterCommit(String... taskIds) {
        Set<String> projects = Arrays.stream(taskIds)
                .map(taskRepository::findById)
                .flatMap(Optional::stream)
                .map(Task::projectId)
                .collect(Collectors.toSet());
        invalidate(projects);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    invalidate(projects);
                }
            });
        }
    }

    private void invalidate(Set<String> projectIds) {
        if (!cacheEnabled) return;
        synchronized (cacheMonitor) {
            generation++;
            projectIds.forEach(graphCache::remove);
        }
    }
}
