package com.herzen.tracker.progress;

import com.herzen.tracker.domain.DomainModels.ProgressEvent;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.repository.ProgressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The only reader and writer of learner progress. A (task, learner) pair without a row is
 * {@code open}; {@link #resolve} is where that rule lives.
 */
@Service
public class ProgressOverlay {
    private static final Logger log = LoggerFactory.getLogger(ProgressOverlay.class);
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final ProgressJdbcRepository repository;
    private final StatusStateMachine stateMachine;
    private final TransactionTemplate transactionTemplate;

    public ProgressOverlay(ProgressJdbcRepository repository,
                           StatusStateMachine stateMachine,
                           TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.transactionTemplate = transactionTemplate;
    }

    public static ProgressRecord resolve(String taskId, String learnerId, Optional<ProgressRecord> stored) {
        return stored.orElseGet(() -> new ProgressRecord(taskId, learnerId, TaskStatus.OPEN, null, null, null, null, false));
    }

    public ProgressRecord getOrDefault(String taskId, String learnerId) {
        return resolve(taskId, learnerId, repository.find(taskId, learnerId));
    }

    public TaskStatus statusOf(String taskId, String learnerId) {
        return getOrDefault(taskId, learnerId).status();
    }

    /**
     * Records of one learner for every given task of a project, one query for the whole project.
     */
    public Map<String, ProgressRecord> snapshot(String projectId, Collection<String> taskIds, String learnerId) {
        Map<String, ProgressRecord> stored = repository.findByProject(projectId, learnerId).stream()
                .collect(Collectors.toMap(ProgressRecord::taskId, Function.identity(), (a, b) -> b));
        Map<String, ProgressRecord> result = new LinkedHashMap<>();
        for (String taskId : taskIds) {
            result.put(taskId, resolve(taskId, learnerId, Optional.ofNullable(stored.get(taskId))));
        }
        return result;
    }

    /**
     * Validates the transition and writes the record together with its event row. The write only
     * lands if the record is still the one that was validated; when a concurrent writer got there
     * first the transition is validated again against the new state.
     */
    public ProgressRecord write(Task task, String learnerId, TaskStatus newStatus, String note) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(tx -> writeOnce(task, learnerId, newStatus, note));
            } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent progress write on {} for learner {}, attempt {}", task.id(), learnerId, attempt);
            }
        }
    }

    private ProgressRecord writeOnce(Task task, String learnerId, TaskStatus newStatus, String note) {
        ProgressRecord current = getOrDefault(task.id(), learnerId);
        Instant now = Instant.now();
        ProgressRecord next = stateMachine.transition(task, current, newStatus, note,
                childId -> statusOf(childId, learnerId), now);
        if (!repository.saveIfUnchanged(current, next)) {
            throw new OptimisticLockingFailureException(
                    "Progress of " + task.id() + " for learner " + learnerId + " changed while it was being written");
        }
        repository.saveEvent(new ProgressEvent(task.id(), learnerId, current.status(), newStatus, note, now));
        return next;
    }

    public List<ProgressEvent> history(String taskId, String learnerId) {
        return repository.loadEvents(taskId, learnerId);
    }
}
