package com.herzen.tracker.progress;

import com.herzen.tracker.domain.DomainModels.ProgressEvent;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.domain.DomainModels.ValidationOutcome;
import com.herzen.tracker.error.TrackerException;
import com.herzen.tracker.graph.TaskGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ProgressService {
    private static final Logger log = LoggerFactory.getLogger(ProgressService.class);

    private final TaskGraphStore graphStore;
    private final ProgressOverlay overlay;
    private final RecordedOutcomeCloseValidator outcomeRecorder;

    public ProgressService(TaskGraphStore graphStore,
                           ProgressOverlay overlay,
                           RecordedOutcomeCloseValidator outcomeRecorder) {
        this.graphStore = graphStore;
        this.overlay = overlay;
        this.outcomeRecorder = outcomeRecorder;
    }

    public ProgressRecord updateStatus(String taskId, String learnerId, TaskStatus newStatus, String note) {
        requireLearner(learnerId);
        if (newStatus == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        Task task = graphStore.getTask(taskId);
        try {
            ProgressRecord updated = overlay.write(task, learnerId, newStatus, note);
            log.info("Learner {} moved {} to {}", learnerId, taskId, newStatus);
            return updated;
        } catch (TrackerException e) {
            log.debug("Learner {} could not move {} to {}: {}", learnerId, taskId, newStatus, e.getMessage());
            throw e;
        }
    }

    public ProgressRecord startTask(String taskId, String learnerId) {
        return updateStatus(taskId, learnerId, TaskStatus.IN_PROGRESS, null);
    }

    public ProgressRecord closeTask(String taskId, String learnerId, String reason) {
        return updateStatus(taskId, learnerId, TaskStatus.CLOSED, reason);
    }

    public ProgressRecord reopenTask(String taskId, String learnerId, String reason) {
        return updateStatus(taskId, learnerId, TaskStatus.OPEN, reason);
    }

    public ProgressRecord getProgress(String taskId, String learnerId) {
        requireLearner(learnerId);
        graphStore.getTask(taskId);
        return overlay.getOrDefault(taskId, learnerId);
    }

    /**
     * Every task of the project with this learner's status, absent rows reported as open.
     */
    public List<ProgressRecord> listProgress(String projectId, String learnerId) {
        requireLearner(learnerId);
        List<String> taskIds = new ArrayList<>(graphStore.projectGraph(projectId).tasks().keySet());
        Map<String, ProgressRecord> snapshot = overlay.snapshot(projectId, taskIds, learnerId);
        return List.copyOf(snapshot.values());
    }

    public List<ProgressEvent> history(String taskId, String learnerId) {
        requireLearner(learnerId);
        graphStore.getTask(taskId);
        return overlay.history(taskId, learnerId);
    }

    public ValidationOutcome recordValidation(String taskId, String learnerId, boolean passed, String message) {
        requireLearner(learnerId);
        graphStore.getTask(taskId);
        return outcomeRecorder.recordOutcome(taskId, learnerId, passed, message);
    }

    private static void requireLearner(String learnerId) {
        if (learnerId == null || learnerId.isBlank()) {
            throw new IllegalArgumentException("Learner id is required");
        }
    }
}
