package com.herzen.tracker;

import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.ProgressEvent;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import com.herzen.tracker.error.BlockedClosureException;
import com.herzen.tracker.error.InvalidTransitionException;
import com.herzen.tracker.error.TaskNotFoundException;
import com.herzen.tracker.error.ValidationRequiredException;
import com.herzen.tracker.graph.TaskGraphStore;
import com.herzen.tracker.progress.ProgressService;
import com.herzen.tracker.progress.StatusStateMachine;
import com.herzen.tracker.repository.ProgressJdbcRepository;
import com.herzen.tracker.service.DependencyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProgressServiceTest {
    private static final String LEARNER = "learner-progress";

    @Autowired
    private TaskGraphStore graphStore;

    @Autowired
    private ProgressService progressService;

    @Autowired
    private DependencyService dependencyService;

    @Autowired
    private ProgressJdbcRepository progressRepository;

    @Test
    void untouchedTaskReadsAsOpen() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);

        ProgressRecord record = progressService.getProgress(a.id(), LEARNER);

        assertEquals(TaskStatus.OPEN, record.status());
        assertFalse(record.persisted());
        assertNull(record.startedAt());
        assertTrue(progressService.history(a.id(), LEARNER).isEmpty());
    }

    @Test
    void startAndCloseStampTimestamps() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);

        ProgressRecord started = progressService.startTask(a.id(), LEARNER);
        assertEquals(TaskStatus.IN_PROGRESS, started.status());
        assertNotNull(started.startedAt());

        progressService.updateStatus(a.id(), LEARNER, TaskStatus.BLOCKED, null);
        ProgressRecord resumed = progressService.startTask(a.id(), LEARNER);
        assertEquals(started.startedAt(), resumed.startedAt());

        ProgressRecord closed = progressService.closeTask(a.id(), LEARNER, "done");
        assertEquals(TaskStatus.CLOSED, closed.status());
        assertNotNull(closed.completedAt());
        assertEquals("done", closed.closeReason());

        ProgressRecord stored = progressService.getProgress(a.id(), LEARNER);
        assertTrue(stored.persisted());
        assertEquals(TaskStatus.CLOSED, stored.status());
        assertEquals(closed.completedAt(), stored.completedAt());
    }

    @Test
    void reopenRequiresReasonAndClearsCompletion() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        progressService.startTask(a.id(), LEARNER);
        progressService.closeTask(a.id(), LEARNER, "done");

        assertThrows(InvalidTransitionException.class, () -> progressService.reopenTask(a.id(), LEARNER, null));
        assertThrows(InvalidTransitionException.class, () -> progressService.reopenTask(a.id(), LEARNER, "  "));
        assertEquals(TaskStatus.CLOSED, progressService.getProgress(a.id(), LEARNER).status());

        ProgressRecord reopened = progressService.reopenTask(a.id(), LEARNER, "found a mistake");
        assertEquals(TaskStatus.OPEN, reopened.status());
        assertNull(reopened.completedAt());
        assertNull(reopened.closeReason());
        assertNotNull(reopened.startedAt());

        List<ProgressEvent> history = progressService.history(a.id(), LEARNER);
        assertEquals(3, history.size());
        ProgressEvent last = history.get(2);
        assertEquals(TaskStatus.CLOSED, last.fromStatus());
        assertEquals(TaskStatus.OPEN, last.toStatus());
        assertEquals("found a mistake", last.note());
    }

    @Test
    void everyTransitionOutsideTheTableIsRejectedAndLeavesStatusAlone() {
        for (TaskStatus from : TaskStatus.values()) {
            for (TaskStatus to : TaskStatus.values()) {
                if (StatusStateMachine.isLegal(from, to)) continue;

                Curriculum c = Curriculum.create(graphStore);
                Task task = c.task("t", 1);
                bringTo(task, from);

                InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                        () -> progressService.updateStatus(task.id(), LEARNER, to, "reason"),
                        from + " -> " + to);
                assertEquals(from, e.from());
                assertEquals(to, e.to());
                assertEquals(from, progressService.getProgress(task.id(), LEARNER).status());
            }
        }
    }

    @Test
    void subtaskWithoutSubmissionCannotClose() {
        Curriculum c = Curriculum.create(graphStore);
        Task parent = c.task("parent", 1);
        Task subtask = c.subtask("sub", parent);
        progressService.startTask(subtask.id(), LEARNER);

        ValidationRequiredException e = assertThrows(ValidationRequiredException.class,
                () -> progressService.closeTask(subtask.id(), LEARNER, "done"));

        assertTrue(e.reason().startsWith("No submission found"));
        assertEquals(TaskStatus.IN_PROGRESS, progressService.getProgress(subtask.id(), LEARNER).status());
    }

    @Test
    void failedSubmissionKeepsSubtaskInProgress() {
        Curriculum c = Curriculum.create(graphStore);
        Task parent = c.task("parent", 1);
        Task subtask = c.subtask("sub", parent);
        progressService.startTask(subtask.id(), LEARNER);
        progressService.recordValidation(subtask.id(), LEARNER, false, "submission failed");

        ValidationRequiredException e = assertThrows(ValidationRequiredException.class,
                () -> progressService.updateStatus(subtask.id(), LEARNER, TaskStatus.CLOSED, null));

        assertEquals("Validation failed: submission failed", e.reason());
        assertEquals(TaskStatus.IN_PROGRESS, progressService.getProgress(subtask.id(), LEARNER).status());
    }

    @Test
    void latestPassingSubmissionAllowsClose() {
        Curriculum c = Curriculum.create(graphStore);
        Task parent = c.task("parent", 1);
        Task subtask = c.subtask("sub", parent);
        progressService.startTask(subtask.id(), LEARNER);
        progressService.recordValidation(subtask.id(), LEARNER, false, "tests red");
        progressService.recordValidation(subtask.id(), LEARNER, true, "tests green");

        assertEquals(TaskStatus.CLOSED, progressService.closeTask(subtask.id(), LEARNER, "passed").status());

        // another learner's submission does not count
        assertThrows(ValidationRequiredException.class, () -> {
            progressService.startTask(subtask.id(), "other-learner");
            progressService.closeTask(subtask.id(), "other-learner", "passed");
        });
    }

    @Test
    void parentClosesOnlyAfterEveryDirectChild() {
        Curriculum c = Curriculum.create(graphStore);
        Task epic = c.epic("epic");
        Task first = c.task("first", epic, 1);
        Task second = c.task("second", epic, 1);
        Task adopted = c.task("adopted", 1);
        dependencyService.addDependency(adopted.id(), epic.id(), DependencyType.PARENT_CHILD);

        progressService.startTask(epic.id(), LEARNER);
        close(first);

        BlockedClosureException e = assertThrows(BlockedClosureException.class,
                () -> progressService.closeTask(epic.id(), LEARNER, "done"));
        assertEquals(List.of(adopted.id(), second.id()).stream().sorted().toList(), e.openChildren());
        assertEquals(TaskStatus.IN_PROGRESS, progressService.getProgress(epic.id(), LEARNER).status());

        close(second);
        close(adopted);
        assertEquals(TaskStatus.CLOSED, progressService.closeTask(epic.id(), LEARNER, "done").status());
    }

    @Test
    void closingEveryChildLeavesParentOpen() {
        Curriculum c = Curriculum.create(graphStore);
        Task epic = c.epic("epic");
        Task only = c.task("only", epic, 1);

        close(only);

        assertEquals(TaskStatus.OPEN, progressService.getProgress(epic.id(), LEARNER).status());
    }

    @Test
    void progressIsKeptPerLearner() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);

        close(a);

        assertEquals(TaskStatus.CLOSED, progressService.getProgress(a.id(), LEARNER).status());
        assertEquals(TaskStatus.OPEN, progressService.getProgress(a.id(), "someone-else").status());
    }

    @Test
    void listProgressCoversUntouchedTasks() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        progressService.startTask(a.id(), LEARNER);

        Map<String, TaskStatus> statuses = progressService.listProgress(c.projectId(), LEARNER).stream()
                .collect(Collectors.toMap(ProgressRecord::taskId, ProgressRecord::status));

        assertEquals(3, statuses.size());
        assertEquals(TaskStatus.IN_PROGRESS, statuses.get(a.id()));
        assertEquals(TaskStatus.OPEN, statuses.get(b.id()));
        assertEquals(TaskStatus.OPEN, statuses.get(c.projectId()));
    }

    @Test
    void rejectsUnknownTaskAndBlankLearner() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);

        assertThrows(TaskNotFoundException.class, () -> progressService.startTask(c.id("missing"), LEARNER));
        assertThrows(IllegalArgumentException.class, () -> progressService.startTask(a.id(), " "));
    }

    @Test
    void concurrentStartsRecordOneTransition() throws Exception {
        for (int round = 0; round < 5; round++) {
            Curriculum c = Curriculum.create(graphStore);
            Task a = c.task("a", 1);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger accepted = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        progressService.startTask(a.id(), LEARNER);
                        accepted.incrementAndGet();
                    } catch (InvalidTransitionException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(1, accepted.get());
            assertEquals(1, rejected.get());
            assertEquals(1, progressService.history(a.id(), LEARNER).size());
        }
    }

    @Test
    void staleRecordIsNotWrittenOver() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        ProgressRecord stale = progressService.startTask(a.id(), LEARNER);
        progressService.updateStatus(a.id(), LEARNER, TaskStatus.BLOCKED, null);

        ProgressRecord overwrite = new ProgressRecord(a.id(), LEARNER, TaskStatus.OPEN, stale.startedAt(),
                null, null, Instant.now(), true);

        assertFalse(progressRepository.saveIfUnchanged(stale, overwrite));
        assertEquals(TaskStatus.BLOCKED, progressService.getProgress(a.id(), LEARNER).status());
    }

    private void bringTo(Task task, TaskStatus status) {
        switch (status) {
            case OPEN -> { }
            case IN_PROGRESS -> progressService.startTask(task.id(), LEARNER);
            case BLOCKED -> progressService.updateStatus(task.id(), LEARNER, TaskStatus.BLOCKED, null);
            case CLOSED -> close(task);
        }
    }

    private void close(Task task) {
        progressService.startTask(task.id(), LEARNER);
        progressService.closeTask(task.id(), LEARNER, "done");
    }
}
