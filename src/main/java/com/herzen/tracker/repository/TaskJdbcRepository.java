package com.herzen.tracker.repository;

import com.herzen.tracker.domain.DomainModels.Task;
import com.herzen.tracker.domain.DomainModels.TaskType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TaskJdbcRepository {
    private static final String COLUMNS = "task_id, parent_id, project_id, title, task_type, priority, created_at";
    private static final RowMapper<Task> TASK_MAPPER = (rs, n) -> new Task(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            TaskType.valueOf(rs.getString(5).toUpperCase()), rs.getInt(6), Instant.parse(rs.getString(7)));

    private final JdbcTemplate jdbcTemplate;

    public TaskJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Task task) {
        jdbcTemplate.update(
                "INSERT INTO tasks(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
                task.id(), task.parentId(), task.projectId(), task.title(),
                task.type().name().toLowerCase(), task.priority(), task.createdAt().toString());
    }

    public Optional<Task> findById(String taskId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tasks WHERE task_id = ?", TASK_MAPPER, taskId)
                .stream().findFirst();
    }

    public boolean exists(String taskId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tasks WHERE task_id = ?", Long.class, taskId);
        return count != null && count > 0;
    }

    public List<Task> findByProject(String projectId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tasks WHERE project_id = ? ORDER BY task_id", TASK_MAPPER, projectId);
    }

    public List<Task> findChildren(String parentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tasks WHERE parent_id = ? ORDER BY task_id", TASK_MAPPER, parentId);
    }

    public Optional<String> findParentId(String taskId) {
        return jdbcTemplate.queryForList("SELECT parent_id FROM tasks WHERE task_id = ?", String.class, taskId)
                .stream().filter(p -> p != null).findFirst();
    }

    public List<String> findProjectIds() {
        return jdbcTemplate.queryForList("SELECT DISTINCT project_id FROM tasks ORDER BY project_id", String.class);
    }
}
