package com.herzen.tracker.readiness;

import com.herzen.tracker.blocking.BlockingResolver;
import com.herzen.tracker.blocking.LearnerBlockingView;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.domain.DomainModels.TaskType;
import com.herzen.tracker.graph.GraphModels.ProjectGraph;
import com.herzen.tracker.graph.TaskGraphStore;
import com.herzen.tracker.progress.ProgressOverlay;
import com.herzen.tracker.readiness.ReadinessModels.ReadyWorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ReadinessRanker {
    private static final Logger log = LoggerFactory.getLogger(ReadinessRanker.class);

    private final TaskGraphStore graphStore;
    private final ProgressOverlay overlay;
    private final BlockingResolver blockingResolver;
    private final int defaultLimit;
    private final int maxLimit;

    public ReadinessRanker(TaskGraphStore graphStore,
                           ProgressOverlay overlay,
                           BlockingResolver blockingResolver,
                           @Value("${tracker.ready-work.default-limit:10}") int defaultLimit,
                           @Value("${tracker.ready-work.max-limit:200}") int maxLimit) {
        this.graphStore = graphStore;
        this.overlay = overlay;
        this.blockingResolver = blockingResolver;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public List<Task> getReadyWork(String projectId, String learnerId, TaskType typeFilter, Integer limit) {
        return rank(projectId, learnerId, typeFilter, limit).stream().map(ReadyWorkItem::task).toList();
    }

    /**
     * Open and in-progress tasks of the project that nothing blocks for this learner, in
     * {@link ReadyWorkItem#ORDER}.
     */
    public List<ReadyWorkItem> rank(String projectId, String learnerId, TaskType typeFilter, Integer limit) {
        if (learnerId == null || learnerId.isBlank()) {
            throw new IllegalArgumentException("Learner id is required");
        }
        int effectiveLimit = effectiveLimit(limit);

        ProjectGraph graph = graphStore.projectGraph(projectId);
        Map<String, ProgressRecord> snapshot = overlay.snapshot(projectId, graph.tasks().keySet(), learnerId);
        LearnerBlockingView view = blockingResolver.projectView(graph, snapshot, learnerId);

        List<ReadyWorkItem> candidates = new ArrayList<>();
        for (Task task : graph.tasks().values()) {
            if (typeFilter != null && task.type() != typeFilter) continue;
            TaskStatus status = snapshot.get(task.id()).status();
            if (status != TaskStatus.OPEN && status != TaskStatus.IN_PROGRESS) continue;
            if (view.evaluate(task.id()).blocked()) continue;
            candidates.add(new ReadyWorkItem(task, status, graph.depth(task.id())));
        }
        candidates.sort(ReadyWorkItem.ORDER);

        List<ReadyWorkItem> ready = candidates.stream().limit(effectiveLimit).toList();
        log.debug("Ready work for learner {} in {}: {} of {} candidates", learnerId, projectId, ready.size(), candidates.size());
        return ready;
    }

    int effectiveLimit(Integer limit) {
        if (limit == null) {
            return Math.min(defaultLimit, maxLimit);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        return Math.min(limit, maxLimit);
    }
}
