package com.herzen.tracker;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CycleGuardTest {
    @Autowired
    private TaskGraphStore graphStore;

    @Autowired
    private CycleGuard cycleGuard;

    @Autowired
    private DependencyService dependencyService;

    @Test
    void graphStaysAcyclicUnderRandomInsertions() {
        Curriculum c = Curriculum.create(graphStore);
        Task epic = c.epic("epic");
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            tasks.add(i % 3 == 0 ? c.task("t" + i, 1) : c.task("t" + i, epic, 1));
        }

        Random random = new Random(42);
        int rejected = 0;
        for (int i = 0; i < 60; i++) {
            Task from = tasks.get(random.nextInt(tasks.size()));
            Task to = tasks.get(random.nextInt(tasks.size()));
            DependencyType type = random.nextBoolean() ? DependencyType.BLOCKS : DependencyType.PARENT_CHILD;
            if (graphStore.edgeExists(from.id(), to.id(), type)) continue;
            try {
                dependencyService.addDependency(from.id(), to.id(), type);
            } catch (RuntimeException e) {
                rejected++;
            }
            assertTrue(cycleGuard.detectCycles(c.projectId()).isEmpty());
        }
        assertTrue(rejected > 0);
    }

    @Test
    void closingPathStartsAndEndsAtSource() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        Task d = c.task("d", 1);
        dependencyService.addDependency(a.id(), b.id(), DependencyType.BLOCKS);
        dependencyService.addDependency(b.id(), d.id(), DependencyType.BLOCKS);

        Optional<List<String>> path = cycleGuard.findClosingPath(d.id(), a.id());

        assertTrue(path.isPresent());
        assertEquals(List.of(d.id(), a.id(), b.id(), d.id()), path.get());
        assertFalse(cycleGuard.wouldCreateCycle(a.id(), d.id()));
    }

    @Test
    void treeLinksTakePartInCycles() {
        Curriculum c = Curriculum.create(graphStore);
        Task epic = c.epic("epic");
        Task child = c.task("child", epic, 1);

        assertTrue(cycleGuard.wouldCreateCycle(epic.id(), child.id()));
        assertTrue(cycleGuard.isAncestor(epic.id(), child.id()));
        assertTrue(cycleGuard.isAncestor(c.projectId(), child.id()));
        assertFalse(cycleGuard.isAncestor(child.id(), epic.id()));
    }

    @Test
    void relatedEdgesAreIgnored() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        dependencyService.addDependency(a.id(), b.id(), DependencyType.RELATED);

        assertFalse(cycleGuard.wouldCreateCycle(b.id(), a.id()));
    }

    @Test
    void detectCyclesFindsEdgesWrittenPastTheGuard() {
        Curriculum c = Curriculum.create(graphStore);
        Task a = c.task("a", 1);
        Task b = c.task("b", 1);
        Task d = c.task("d", 1);
        Task e = c.task("e", 1);
        Task f = c.task("f", 1);

        // raw store writes skip the insertion check, as a corrupted import would
        graphStore.addEdge(new Dependency(a.id(), b.id(), DependencyType.BLOCKS, Instant.now(), null));
        graphStore.addEdge(new Dependency(b.id(), d.id(), DependencyType.BLOCKS, Instant.now(), null));
        graphStore.addEdge(new Dependency(d.id(), a.id(), DependencyType.PARENT_CHILD, Instant.now(), null));
        graphStore.addEdge(new Dependency(e.id(), f.id(), DependencyType.BLOCKS, Instant.now(), null));
        graphStore.addEdge(new Dependency(f.id(), e.id(), DependencyType.BLOCKS, Instant.now(), null));

        List<List<String>> cycles = cycleGuard.detectCycles(c.projectId());

        assertEquals(2, cycles.size());
        assertEquals(List.of(a.id(), b.id(), d.id()), cycles.get(0));
        assertEquals(List.of(e.id(), f.id()), cycles.get(1));
    }

    @Test
    void detectCyclesHandlesDeepChains() {
        Curriculum c = Curriculum.create(graphStore);
        Task previous = c.task("n0", 1);
        for (int i = 1; i < 400; i++) {
            Task next = c.task("n" + i, 1);
            graphStore.addEdge(new Dependency(next.id(), previous.id(), DependencyType.BLOCKS, Instant.now(), null));
            previous = next;
        }

        assertTrue(cycleGuard.detectCycles(c.projectId()).isEmpty());
    }
}
