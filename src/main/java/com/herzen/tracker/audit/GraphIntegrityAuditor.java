package com.herzen.tracker.audit;

import com.herzen.tracker.graph.CycleGuard;
import com.herzen.tracker.graph.TaskGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Offline cycle detection over every project. Never called from the learner-facing paths.
 */
@Service
public class GraphIntegrityAuditor {
    private static final Logger log = LoggerFactory.getLogger(GraphIntegrityAuditor.class);

    private final TaskGraphStore graphStore;
    private final CycleGuard cycleGuard;
    private final boolean enabled;
    private final AtomicReference<AuditReport> latest = new AtomicReference<>();

    public GraphIntegrityAuditor(TaskGraphStore graphStore,
                                 CycleGuard cycleGuard,
                                 @Value("${tracker.audit.enabled:true}") boolean enabled) {
        this.graphStore = graphStore;
        this.cycleGuard = cycleGuard;
        this.enabled = enabled;
    }

    public record AuditReport(Instant startedAt, Instant finishedAt, int projectsScanned, Map<String, List<List<String>>> cycles) {
        public boolean clean() {
            return cycles.isEmpty();
        }
    }

    @Scheduled(fixedDelayString = "${tracker.audit.fixed-delay-ms:3600000}",
            initialDelayString = "${tracker.audit.initial-delay-ms:60000}")
    public void scheduledAudit() {
        if (!enabled) return;
        try {
            runAudit();
        } catch (RuntimeException e) {
            log.error("Graph audit failed", e);
        }
    }

    public AuditReport runAudit() {
        Instant startedAt = Instant.now();
        List<String> projectIds = graphStore.projectIds();
        Map<String, List<List<String>>> cycles = new LinkedHashMap<>();
        for (String projectId : projectIds) {
            List<List<String>> found = cycleGuard.detectCycles(projectId);
            if (!found.isEmpty()) {
                found.forEach(c -> log.warn("Blocking cycle in project {}: {}", projectId, c));
                cycles.put(projectId, found);
            }
        }
        AuditReport report = new AuditReport(startedAt, Instant.now(), projectIds.size(), Map.copyOf(cycles));
        latest.set(report);
        log.info("Graph audit scanned {} projects, {} with cycles", projectIds.size(), cycles.size());
        return report;
    }

    public Optional<AuditReport> latest() {
        return Optional.ofNullable(latest.get());
    }
}
