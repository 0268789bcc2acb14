package com.herzen.tracker.blocking;

import com.herzen.tracker.blocking.BlockingModels.BlockedTask;
import com.herzen.tracker.blocking.BlockingModels.BlockingLink;
import com.herzen.tracker.blocking.BlockingModels.BlockingResult;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.graph.GraphModels.ProjectGraph;
import com.herzen.tracker.graph.TaskGraphStore;
import com.herzen.tracker.progress.ProgressOverlay;
import com.herzen.tracker.readiness.ReadinessModels.ReadyWorkItem;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Answers "is this task blocked for this learner". Only BLOCKS and PARENT_CHILD edges (plus tree
 * links) are followed; RELATED edges are never read here. Every call builds a fresh
 * {@link LearnerBlockingView}, so one learner's closures never leak into another's answer.
 */
@Service
public class BlockingResolver {
    private final TaskGraphStore graphStore;
    private final ProgressOverlay overlay;

    public BlockingResolver(TaskGraphStore graphStore, ProgressOverlay overlay) {
        this.graphStore = graphStore;
        this.overlay = overlay;
    }

    public BlockingResult isBlocked(String taskId, String learnerId) {
        graphStore.getTask(taskId);
        return storeView(learnerId).evaluate(taskId);
    }

    public boolean isTaskReady(String taskId, String learnerId) {
        graphStore.getTask(taskId);
        LearnerBlockingView view = storeView(learnerId);
        TaskStatus status = view.status(taskId);
        if (status != TaskStatus.OPEN && status != TaskStatus.IN_PROGRESS) {
            return false;
        }
        return !view.evaluate(taskId).blocked();
    }

    /**
     * Every task transitively holding {@code taskId} up, breadth-first. Each task appears once,
     * at the depth where it was first reached.
     */
    public List<BlockingLink> getBlockingChain(String taskId, String learnerId) {
        graphStore.getTask(taskId);
        LearnerBlockingView view = storeView(learnerId);

        List<BlockingLink> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>(Set.of(taskId));
        Deque<BlockingLink> queue = new ArrayDeque<>();
        queue.add(new BlockingLink(taskId, null, 0, view.status(taskId)));
        while (!queue.isEmpty()) {
            BlockingLink current = queue.poll();
            for (String blockerId : view.evaluate(current.taskId()).blockers()) {
                if (!seen.add(blockerId)) continue;
                BlockingLink link = new BlockingLink(blockerId, current.taskId(), current.depth() + 1, view.status(blockerId));
                chain.add(link);
                queue.add(link);
            }
        }
        return chain;
    }

    /**
     * Non-closed tasks of the project that are blocked for the learner, together with tasks the
     * learner has marked blocked by hand.
     */
    public List<BlockedTask> getBlockedTasks(String projectId, String learnerId) {
        ProjectGraph graph = graphStore.projectGraph(projectId);
        Map<String, ProgressRecord> snapshot = overlay.snapshot(projectId, graph.tasks().keySet(), learnerId);
        LearnerBlockingView view = projectView(graph, snapshot, learnerId);

        Map<String, BlockedTask> blocked = new HashMap<>();
        List<ReadyWorkItem> order = new ArrayList<>();
        for (Task task : graph.tasks().values()) {
            TaskStatus status = snapshot.get(task.id()).status();
            if (status == TaskStatus.CLOSED) continue;
            BlockingResult result = view.evaluate(task.id());
            if (result.blocked() || status == TaskStatus.BLOCKED) {
                blocked.put(task.id(), new BlockedTask(task, status, result.blockers()));
                order.add(new ReadyWorkItem(task, status, graph.depth(task.id())));
            }
        }
        order.sort(ReadyWorkItem.ORDER);
        return order.stream().map(item -> blocked.get(item.task().id())).toList();
    }

    /**
     * Blocking view over one project's snapshot. Edges that leave the project fall back to the
     * store so cross-project blockers are still honoured.
     */
    public LearnerBlockingView projectView(ProjectGraph graph, Map<String, ProgressRecord> snapshot, String learnerId) {
        return new LearnerBlockingView(learnerId,
                id -> graph.contains(id) ? graph.targets(id, DependencyType.BLOCKS) : graphStore.blockerIdsOf(id),
                id -> graph.contains(id) ? graph.parentsOf(id) : graphStore.parentIdsOf(id),
                id -> {
                    ProgressRecord record = snapshot.get(id);
                    return record != null ? record.status() : overlay.statusOf(id, learnerId);
                });
    }

    private LearnerBlockingView storeView(String learnerId) {
        return new LearnerBlockingView(learnerId,
                graphStore::blockerIdsOf,
                graphStore::parentIdsOf,
                id -> overlay.statusOf(id, learnerId));
    }
}
