package com.herzen.tracker.progress;

import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.domain.DomainModels.TaskType;
import com.herzen.tracker.error.BlockedClosureException;
import com.herzen.tracker.error.InvalidTransitionException;
import com.herzen.tracker.error.ValidationRequiredException;
import com.herzen.tracker.graph.TaskGraphStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static com.herzen.tracker.domain.DomainModels.TaskStatus.*;

/**
 * Legal per-learner status transitions and the extra gates on closing.
 *
 * <pre>
 * open        -> in_progress, blocked
 * in_progress -> open, blocked, closed
 * blocked     -> open, in_progress
 * closed      -> open   (reopen, reason required)
 * </pre>
 */
@Component
public class StatusStateMachine {
    private static final Map<TaskStatus, Set<TaskStatus>> LEGAL = new EnumMap<>(TaskStatus.class);

    static {
        LEGAL.put(OPEN, EnumSet.of(IN_PROGRESS, BLOCKED));
        LEGAL.put(IN_PROGRESS, EnumSet.of(OPEN, BLOCKED, CLOSED));
        LEGAL.put(BLOCKED, EnumSet.of(OPEN, IN_PROGRESS));
        LEGAL.put(CLOSED, EnumSet.of(OPEN));
    }

    private final CloseValidator closeValidator;
    private final TaskGraphStore graphStore;

    public StatusStateMachine(CloseValidator closeValidator, TaskGraphStore graphStore) {
        this.closeValidator = closeValidator;
        this.graphStore = graphStore;
    }

    public static boolean isLegal(TaskStatus from, TaskStatus to) {
        return LEGAL.get(from).contains(to);
    }

    public static Set<TaskStatus> legalTargets(TaskStatus from) {
        return EnumSet.copyOf(LEGAL.get(from));
    }

    /**
     * Validates {@code current -> target} and returns the record to persist. Nothing is written
     * here; a rejection leaves the stored record as it was.
     *
     * @param note          close reason when closing, reopen reason when reopening
     * @param learnerStatus status lookup for the same learner, used for the child-closure gate
     */
    public ProgressRecord transition(Task task,
                                     ProgressRecord current,
                                     TaskStatus target,
                                     String note,
                                     Function<String, TaskStatus> learnerStatus,
                                     Instant now) {
        TaskStatus from = current.status();
        if (!isLegal(from, target)) {
            throw new InvalidTransitionException(from, target);
        }
        if (from == CLOSED && (note == null || note.isBlank())) {
            throw new InvalidTransitionException(from, target, "Reopening a closed task requires a reason");
        }
        if (target == CLOSED) {
            checkCloseGates(task, current.learnerId(), learnerStatus);
        }

        Instant startedAt = target == IN_PROGRESS && current.startedAt() == null ? now : current.startedAt();
        Instant completedAt = target == CLOSED ? now : null;
        String closeReason = target == CLOSED ? note : null;
        return new ProgressRecord(current.taskId(), current.learnerId(), target, startedAt, completedAt, closeReason, now, true);
    }

    private void checkCloseGates(Task task, String learnerId, Function<String, TaskStatus> learnerStatus) {
        if (task.type() == TaskType.SUBTASK) {
            CloseValidator.CloseCheck check = closeValidator.mayClose(task.id(), learnerId);
            if (!check.allowed()) {
                throw new ValidationRequiredException(task.id(), check.reason());
            }
        }

        // direct children only; deeper levels were checked when those children closed
        List<String> openChildren = graphStore.childrenOf(task.id()).stream()
                .map(Task::id)
                .filter(childId -> learnerStatus.apply(childId) != CLOSED)
                .toList();
        if (!openChildren.isEmpty()) {
            throw new BlockedClosureException(task.id(), openChildren);
        }
    }
}
