package com.herzen.tracker.repository;

import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class DependencyJdbcRepository {
    private static final String COLUMNS = "d.task_id, d.depends_on_id, d.dependency_type, d.created_at, d.created_by";
    private static final RowMapper<Dependency> DEPENDENCY_MAPPER = (rs, n) -> new Dependency(
            rs.getString(1), rs.getString(2), DependencyType.valueOf(rs.getString(3).toUpperCase()),
            Instant.parse(rs.getString(4)), rs.getString(5));

    private final JdbcTemplate jdbcTemplate;

    public DependencyJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Dependency dependency) {
        jdbcTemplate.update(
                "INSERT INTO dependencies(task_id, depends_on_id, dependency_type, created_at, created_by) VALUES (?,?,?,?,?)",
                dependency.taskId(), dependency.dependsOnId(), dbValue(dependency.type()),
                dependency.createdAt().toString(), dependency.createdBy());
    }

    public int delete(String taskId, String dependsOnId, DependencyType type) {
        return jdbcTemplate.update(
                "DELETE FROM dependencies WHERE task_id = ? AND depends_on_id = ? AND dependency_type = ?",
                taskId, dependsOnId, dbValue(type));
    }

    public boolean exists(String taskId, String dependsOnId, DependencyType type) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM dependencies WHERE task_id = ? AND depends_on_id = ? AND dependency_type = ?",
                Long.class, taskId, dependsOnId, dbValue(type));
        return count != null && count > 0;
    }

    public List<Dependency> findOutgoing(String taskId, DependencyType type) {
        String typeValue = type == null ? null : dbValue(type);
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM dependencies d WHERE d.task_id = ? AND (CAST(? AS VARCHAR) IS NULL OR d.dependency_type = ?) " +
                        "ORDER BY d.depends_on_id, d.dependency_type",
                DEPENDENCY_MAPPER, taskId, typeValue, typeValue);
    }

    public List<Dependency> findIncoming(String taskId, DependencyType type) {
        String typeValue = type == null ? null : dbValue(type);
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM dependencies d WHERE d.depends_on_id = ? AND (CAST(? AS VARCHAR) IS NULL OR d.dependency_type = ?) " +
                        "ORDER BY d.task_id, d.dependency_type",
                DEPENDENCY_MAPPER, taskId, typeValue, typeValue);
    }

    /**
     * Targets of the blocking-subgraph edges leaving {@code taskId} (BLOCKS and explicit PARENT_CHILD).
     */
    public List<String> findBlockingTargets(String taskId) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT depends_on_id FROM dependencies WHERE task_id = ? AND dependency_type IN ('blocks', 'parent_child') " +
                        "ORDER BY depends_on_id",
                String.class, taskId);
    }

    /**
     * Every edge whose source task belongs to the project.
     */
    public List<Dependency> findByProject(String projectId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM dependencies d JOIN tasks t ON t.task_id = d.task_id WHERE t.project_id = ? " +
                        "ORDER BY d.task_id, d.depends_on_id, d.dependency_type",
                DEPENDENCY_MAPPER, projectId);
    }

    private static String dbValue(DependencyType type) {
        return type.name().toLowerCase();
    }
}
