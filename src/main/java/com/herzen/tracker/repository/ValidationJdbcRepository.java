package com.herzen.tracker.repository;

import com.herzen.tracker.domain.DomainModels.ValidationOutcome;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class ValidationJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ValidationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(ValidationOutcome outcome) {
        jdbcTemplate.update(
                "INSERT INTO validation_outcomes(task_id, learner_id, passed, message, validated_at) VALUES (?,?,?,?,?)",
                outcome.taskId(), outcome.learnerId(), outcome.passed(), outcome.message(), outcome.validatedAt().toString());
    }

    public Optional<ValidationOutcome> findLatest(String taskId, String learnerId) {
        return jdbcTemplate.query(
                "SELECT task_id, learner_id, passed, message, validated_at FROM validation_outcomes " +
                        "WHERE task_id = ? AND learner_id = ? ORDER BY id DESC LIMIT 1",
                (rs, n) -> new ValidationOutcome(rs.getString(1), rs.getString(2), rs.getBoolean(3),
                        rs.getString(4), Instant.parse(rs.getString(5))),
                taskId, learnerId).stream().findFirst();
    }
}
