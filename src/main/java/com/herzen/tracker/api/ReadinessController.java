package com.herzen.tracker.api;

import com.herzen.tracker.blocking.BlockingModels.BlockedTask;
import com.herzen.tracker.blocking.BlockingModels.BlockingLink;
import com.herzen.tracker.blocking.BlockingModels.BlockingResult;
import com.herzen.tracker.blocking.BlockingResolver;
import com.herzen.tracker.domain.DomainModels.TaskType;
import com.herzen.tracker.readiness.ReadinessModels.ReadyWorkItem;
import com.herzen.tracker.readiness.ReadinessRanker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/learners/{learnerId}")
public class ReadinessController {
    private final BlockingResolver blockingResolver;
    private final ReadinessRanker readinessRanker;

    public ReadinessController(BlockingResolver blockingResolver, ReadinessRanker readinessRanker) {
        this.blockingResolver = blockingResolver;
        this.readinessRanker = readinessRanker;
    }

    @GetMapping("/tasks/{taskId}/blocking")
    public ResponseEntity<BlockingResult> blocking(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(blockingResolver.isBlocked(taskId, learnerId));
    }

    @GetMapping("/tasks/{taskId}/ready")
    public ResponseEntity<ReadyResponse> ready(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(new ReadyResponse(taskId, learnerId, blockingResolver.isTaskReady(taskId, learnerId)));
    }

    @GetMapping("/tasks/{taskId}/chain")
    public ResponseEntity<List<BlockingLink>> chain(@PathVariable String learnerId, @PathVariable String taskId) {
        return ResponseEntity.ok(blockingResolver.getBlockingChain(taskId, learnerId));
    }

    @GetMapping("/projects/{projectId}/ready-work")
    public ResponseEntity<List<ReadyWorkItem>> readyWork(@PathVariable String learnerId,
                                                         @PathVariable String projectId,
                                                         @RequestParam(required = false) TaskType type,
                                                         @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(readinessRanker.rank(projectId, learnerId, type, limit));
    }

    @GetMapping("/projects/{projectId}/blocked")
    public ResponseEntity<List<BlockedTask>> blocked(@PathVariable String learnerId, @PathVariable String projectId) {
        return ResponseEntity.ok(blockingResolver.getBlockedTasks(projectId, learnerId));
    }

    public record ReadyResponse(String taskId, String learnerId, boolean ready) {}
}
