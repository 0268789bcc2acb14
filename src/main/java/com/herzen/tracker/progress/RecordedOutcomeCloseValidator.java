package com.herzen.tracker.progress;

import com.herzen.tracker.domain.DomainModels.ValidationOutcome;
import com.herzen.tracker.repository.ValidationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Answers {@code mayClose} from the latest outcome the grading side recorded for the
 * (task, learner) pair.
 */
@Component
public class RecordedOutcomeCloseValidator implements CloseValidator {
    private static final Logger log = LoggerFactory.getLogger(RecordedOutcomeCloseValidator.class);

    static final String NO_SUBMISSION = "No submission found. Submit your work before closing.";

    private final ValidationJdbcRepository repository;

    public RecordedOutcomeCloseValidator(ValidationJdbcRepository repository) {
        this.repository = repository;
    }

    public ValidationOutcome recordOutcome(String taskId, String learnerId, boolean passed, String message) {
        ValidationOutcome outcome = new ValidationOutcome(taskId, learnerId, passed, message, Instant.now());
        repository.save(outcome);
        log.info("Recorded {} validation for task {} learner {}", passed ? "passing" : "failing", taskId, learnerId);
        return outcome;
    }

    @Override
    public CloseCheck mayClose(String taskId, String learnerId) {
        Optional<ValidationOutcome> latest = repository.findLatest(taskId, learnerId);
        if (latest.isEmpty()) {
            return CloseCheck.deny(NO_SUBMISSION);
        }
        if (!latest.get().passed()) {
            String message = latest.get().message();
            return CloseCheck.deny("Validation failed: " + (message == null || message.isBlank() ? "no details" : message));
        }
        return CloseCheck.allow();
    }
}
