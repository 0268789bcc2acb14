package com.herzen.tracker.api;

import com.herzen.tracker.domain.DomainModels.ProgressEvent;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.progress.ProgressService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/learners/{learnerId}")
public class ProgressController {
    private final ProgressService progressService;

    public ProgressController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @PostMapping("/tasks/{taskId}/status")
    public ResponseEntity<ProgressRecord> updateStatus(@PathVariable String learnerId,
                                                       @PathVariable String taskId,
                                                       @RequestBody StatusRequest request) {
        return ResponseEntity.ok(progressService.updateStatus(taskId, learnerId, request.status(), request.reason()));
    }

    @PostMapping("/tasks/{taskId}/start")
    public ResponseEntity<ProgressRecord> start(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(progressService.startTask(taskId, learnerId));
    }

    @PostMapping("/tasks/{taskId}/close")
    public ResponseEntity<ProgressRecord> close(@PathVariable String learnerId,
                                                @PathVariable String taskId,
                                                @RequestBody(required = false) ReasonRequest request) {
        return ResponseEntity.ok(progressService.closeTask(taskId, learnerId, request == null ? null : request.reason()));
    }

    @PostMapping("/tasks/{taskId}/reopen")
    public ResponseEntity<ProgressRecord> reopen(@PathVariable String learnerId,
                                                 @PathVariable String taskId,
                                                 @RequestBody(required = false) ReasonRequest request) {
        return ResponseEntity.ok(progressService.reopenTask(taskId, learnerId, request == null ? null : request.reason()));
    }

    @GetMapping("/tasks/{taskId}/progress")
    public ResponseEntity<ProgressRecord> progress(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(progressService.getProgress(taskId, learnerId));
    }

    @GetMapping("/tasks/{taskId}/history")
    public ResponseEntity<List<ProgressEvent>> history(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(progressService.history(taskId, learnerId));
    }

    @GetMapping("/projects/{projectId}/progress")
    public ResponseEntity<List<ProgressRecord>> projectProgress(@PathVariable String learnerId, @PathVariable String projectId) {
        return ResponseEntity.ok(progressService.listProgress(projectId, learnerId));
    }

    public record StatusRequest(TaskStatus status, String reason) {}

    public record ReasonRequest(String reason) {}
}
