package com.herzen.tracker.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public class GraphLockJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public GraphLockJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Writes the project's lock row. Must run inside a transaction: the row stays locked
     * until that transaction ends, which serializes graph writers on other nodes.
     */
    public void lockProject(String projectId) {
        jdbcTemplate.update(
                "MERGE INTO graph_locks(project_id, locked_at) KEY(project_id) VALUES (?,?)",
                projectId, Instant.now().toString());
    }
}
