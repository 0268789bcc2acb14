package com.herzen.tracker.api;

import com.herzen.tracker.domain.DomainModels.ValidationOutcome;
import com.herzen.tracker.progress.ProgressService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Entry point for the external grader: the latest outcome per (task, learner) gates subtask closure.
 */
@RestController
@RequestMapping("/api/validations")
public class ValidationController {
    private final ProgressService progressService;

    public ValidationController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @PostMapping
    public ResponseEntity<ValidationOutcome> record(@RequestBody OutcomeRequest request) {
        ValidationOutcome outcome = progressService.recordValidation(request.taskId(), request.learnerId(), request.passed(), request.message());
        return ResponseEntity.status(HttpStatus.CREATED).body(outcome);
    }

    public record OutcomeRequest(String taskId, String learnerId, boolean passed, String message) {}
}
