package com.herzen.tracker.api;

import com.herzen.tracker.audit.GraphIntegrityAuditor;
import com.herzen.tracker.audit.GraphIntegrityAuditor.AuditReport;
import com.herzen.tracker.graph.CycleGuard;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {
    private final CycleGuard cycleGuard;
    private final GraphIntegrityAuditor auditor;

    public AuditController(CycleGuard cycleGuard, GraphIntegrityAuditor auditor) {
        this.cycleGuard = cycleGuard;
        this.auditor = auditor;
    }

    @GetMapping("/projects/{projectId}/cycles")
    public ResponseEntity<List<List<String>>> cycles(@PathVariable String projectId) {
        return ResponseEntity.ok(cycleGuard.detectCycles(projectId));
    }

    @PostMapping("/run")
    public ResponseEntity<AuditReport> run() {
        return ResponseEntity.ok(auditor.runAudit());
    }

    @GetMapping("/latest")
    public ResponseEntity<AuditReport> latest() {
        return auditor.latest().map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }
}
