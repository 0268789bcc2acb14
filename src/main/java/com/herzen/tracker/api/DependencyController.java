package com.herzen.tracker.api;

import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.service.DependencyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class DependencyController {
    private final DependencyService dependencyService;

    public DependencyController(DependencyService dependencyService) {
        this.dependencyService = dependencyService;
    }

    @PostMapping("/dependencies")
    public ResponseEntity<Dependency> add(@RequestBody DependencyRequest request) {
        Dependency created = dependencyService.addDependency(request.taskId(), request.dependsOnId(), request.type(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/dependencies")
    public ResponseEntity<Void> remove(@RequestParam String taskId,
                                       @RequestParam String dependsOnId,
                                       @RequestParam DependencyType type) {
        dependencyService.removeDependency(taskId, dependsOnId, type);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tasks/{taskId}/dependencies")
    public ResponseEntity<List<Dependency>> dependencies(@PathVariable String taskId,
                                                         @RequestParam(required = false) DependencyType type) {
        return ResponseEntity.ok(dependencyService.getDependencies(taskId, type));
    }

    @GetMapping("/tasks/{taskId}/dependents")
    public ResponseEntity<List<Dependency>> dependents(@PathVariable String taskId,
                                                       @RequestParam(required = false) DependencyType type) {
        return ResponseEntity.ok(dependencyService.getDependents(taskId, type));
    }

    public record DependencyRequest(String taskId, String dependsOnId, DependencyType type, String createdBy) {}
}
