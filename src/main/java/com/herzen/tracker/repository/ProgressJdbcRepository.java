package com.herzen.tracker.repository;

import com.herzen.tracker.domain.DomainModels.ProgressEvent;
import com.herzen.tracker.domain.DomainModels.ProgressRecord;
import com.herzen.tracker.domain.DomainModels.TaskStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ProgressJdbcRepository {
    private static final String COLUMNS = "p.task_id, p.learner_id, p.status, p.started_at, p.completed_at, p.close_reason, p.updated_at";
    private static final RowMapper<ProgressRecord> PROGRESS_MAPPER = (rs, n) -> new ProgressRecord(
            rs.getString(1), rs.getString(2), status(rs.getString(3)),
            instant(rs.getString(4)), instant(rs.getString(5)), rs.getString(6), instant(rs.getString(7)), true);

    private final JdbcTemplate jdbcTemplate;

    public ProgressJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ProgressRecord> find(String taskId, String learnerId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM learner_task_progress p WHERE p.task_id = ? AND p.learner_id = ?",
                PROGRESS_MAPPER, taskId, learnerId).stream().findFirst();
    }

    /**
     * Materialized rows of one learner for the tasks of a project. Untouched tasks have no row.
     */
    public List<ProgressRecord> findByProject(String projectId, String learnerId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM learner_task_progress p JOIN tasks t ON t.task_id = p.task_id " +
                        "WHERE t.project_id = ? AND p.learner_id = ?",
                PROGRESS_MAPPER, projectId, learnerId);
    }

    /**
     * Writes {@code next} only if the stored row still is {@code current}: a plain insert for a
     * pair that had no row (a concurrent insert surfaces as {@code DuplicateKeyException}), an
     * update guarded on status and {@code updated_at} otherwise.
     *
     * @return false when another writer changed the row since {@code current} was read
     */
    public boolean saveIfUnchanged(ProgressRecord current, ProgressRecord next) {
        if (!current.persisted()) {
            jdbcTemplate.update(
                    "INSERT INTO learner_task_progress(task_id, learner_id, status, started_at, completed_at, close_reason, updated_at) " +
                            "VALUES (?,?,?,?,?,?,?)",
                    next.taskId(), next.learnerId(), dbValue(next.status()),
                    text(next.startedAt()), text(next.completedAt()), next.closeReason(), text(next.updatedAt()));
            return true;
        }
        int updated = jdbcTemplate.update(
                "UPDATE learner_task_progress SET status = ?, started_at = ?, completed_at = ?, close_reason = ?, updated_at = ? " +
                        "WHERE task_id = ? AND learner_id = ? AND status = ? AND updated_at = ?",
                dbValue(next.status()), text(next.startedAt()), text(next.completedAt()), next.closeReason(), text(next.updatedAt()),
                current.taskId(), current.learnerId(), dbValue(current.status()), text(current.updatedAt()));
        return updated == 1;
    }

    public void saveEvent(ProgressEvent event) {
        jdbcTemplate.update(
                "INSERT INTO progress_events(task_id, learner_id, from_status, to_status, note, ts) VALUES (?,?,?,?,?,?)",
                event.taskId(), event.learnerId(), dbValue(event.fromStatus()), dbValue(event.toStatus()),
                event.note(), event.ts().toString());
    }

    public List<ProgressEvent> loadEvents(String taskId, String learnerId) {
        return jdbcTemplate.query(
                "SELECT task_id, learner_id, from_status, to_status, note, ts FROM progress_events " +
                        "WHERE task_id = ? AND learner_id = ? ORDER BY id",
                (rs, n) -> new ProgressEvent(rs.getString(1), rs.getString(2), status(rs.getString(3)),
                        status(rs.getString(4)), rs.getString(5), Instant.parse(rs.getString(6))),
                taskId, learnerId);
    }

    private static TaskStatus status(String value) {
        return TaskStatus.valueOf(value.toUpperCase());
    }

    private static String dbValue(TaskStatus status) {
        return status.name().toLowerCase();
    }

    private static Instant instant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private static String text(Instant value) {
        return value == null ? null : value.toString();
    }
}
