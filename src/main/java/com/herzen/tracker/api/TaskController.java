package com.herzen.tracker.api;

import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskType;
import com.herzen.tracker.graph.TaskGraphStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {
    private final TaskGraphStore graphStore;

    public TaskController(TaskGraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @PostMapping
    public ResponseEntity<Task> create(@RequestBody CreateTaskRequest request) {
        Task task = new Task(request.id(), request.parentId(), request.projectId(), request.title(), request.type(),
                request.priority() == null ? 2 : request.priority(), request.createdAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(graphStore.addTask(task));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Task> get(@PathVariable String taskId) {
        return ResponseEntity.ok(graphStore.getTask(taskId));
    }

    @GetMapping("/{taskId}/children")
    public ResponseEntity<List<Task>> children(@PathVariable String taskId) {
        graphStore.getTask(taskId);
        return ResponseEntity.ok(graphStore.childrenOf(taskId));
    }

    @GetMapping("/{taskId}/ancestors")
    public ResponseEntity<List<Task>> ancestors(@PathVariable String taskId) {
        return ResponseEntity.ok(graphStore.ancestorsOf(taskId));
    }

    public record CreateTaskRequest(String id,
                                    String parentId,
                                    String projectId,
                                    String title,
                                    TaskType type,
                                    Integer priority,
                                    Instant createdAt) {}
}
