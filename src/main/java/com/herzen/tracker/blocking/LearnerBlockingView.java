package com.herzen.tracker.blocking;

import com.herzen.tracker.blocking.BlockingModels.BlockingResult;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Blocking evaluation for a single learner. Results are memoised for the lifetime of the view,
 * which is one request; nothing here is shared between learners.
 */
public class LearnerBlockingView {
    private static final Logger log = LoggerFactory.getLogger(LearnerBlockingView.class);

    private final String learnerId;
    private final Function<String, List<String>> blockerIds;
    private final Function<String, List<String>> parentIds;
    private final Function<String, TaskStatus> statusOf;

    private final Map<String, BlockingResult> memo = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    LearnerBlockingView(String learnerId,
                        Function<String, List<String>> blockerIds,
                        Function<String, List<String>> parentIds,
                        Function<String, TaskStatus> statusOf) {
        this.learnerId = learnerId;
        this.blockerIds = blockerIds;
        this.parentIds = parentIds;
        this.statusOf = statusOf;
    }

    public TaskStatus status(String taskId) {
        return statusOf.apply(taskId);
    }

    public BlockingResult evaluate(String taskId) {
        BlockingResult known = memo.get(taskId);
        if (known != null) return known;

        if (!inProgress.add(taskId)) {
            // only reachable when the stored graph already holds a cycle
            log.warn("Cycle through {} while evaluating blocking for learner {}", taskId, learnerId);
            return BlockingResult.clear(taskId, learnerId);
        }

        List<String> blockers = new ArrayList<>();
        for (String dependencyId : blockerIds.apply(taskId)) {
            if (statusOf.apply(dependencyId) != TaskStatus.CLOSED || evaluate(dependencyId).blocked()) {
                blockers.add(dependencyId);
            }
        }
        for (String parentId : parentIds.apply(taskId)) {
            if (evaluate(parentId).blocked() && !blockers.contains(parentId)) {
                blockers.add(parentId);
            }
        }

        inProgress.remove(taskId);
        BlockingResult result = new BlockingResult(taskId, learnerId, !blockers.isEmpty(), List.copyOf(blockers));
        memo.put(taskId, result);
        return result;
    }
}
