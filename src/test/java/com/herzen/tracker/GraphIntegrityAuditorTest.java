package com.herzen.tracker;

import com.herzen.tracker.audit.GraphIntegrityAuditor;
import com.herzen.tracker.audit.GraphIntegrityAuditor.AuditReport;
import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.graph.CycleGuard;
import com.herzen.tracker.graph.TaskGraphStore;
import com.herzen.tracker.service.DependencyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@SpringBootTest
class GraphIntegrityAuditorTest {
    @Autowired
    private TaskGraphStore graphStore;

    @Autowired
    private DependencyService dependencyService;

    @Autowired
    private GraphIntegrityAuditor auditor;

    @Test
    void cleanProjectIsNotReported() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        dependencyService.addDependency(a.id(), b.id(), DependencyType.BLOCKS);

        AuditReport report = auditor.runAudit();

        assertFalse(report.cycles().containsKey(c.projectId()));
        assertTrue(report.projectsScanned() >= 1);
        assertTrue(auditor.latest().isPresent());
    }

    @Test
    void reportsCyclesLeftBehindByRawWrites() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        graphStore.addEdge(new Dependency(a.id(), b.id(), DependencyType.BLOCKS, Instant.now(), "import"));
        graphStore.addEdge(new Dependency(b.id(), a.id(), DependencyType.BLOCKS, Instant.now(), "import"));

        AuditReport report = auditor.runAudit();

        assertFalse(report.clean());
        assertEquals(List.of(List.of(a.id(), b.id())), report.cycles().get(c.projectId()));
        assertSame(report, auditor.latest().orElseThrow());
    }

    @Test
    void disabledScheduleDoesNotTouchTheStore() {
        TaskGraphStore store = mock(TaskGraphStore.class);
        CycleGuard guard = mock(CycleGuard.class);

        new GraphIntegrityAuditor(store, guard, false).scheduledAudit();

        verifyNoInteractions(store, guard);
    }

    @Test
    void failedScheduledRunIsLoggedNotThrown() {
        TaskGraphStore store = mock(TaskGraphStore.class);
        CycleGuard guard = mock(CycleGuard.class);
        when(store.projectIds()).thenThrow(new IllegalStateException("database down"));
        GraphIntegrityAuditor enabled = new GraphIntegrityAuditor(store, guard, true);

        assertDoesNotThrow(enabled::scheduledAudit);
        assertTrue(enabled.latest().isEmpty());
    }
}
