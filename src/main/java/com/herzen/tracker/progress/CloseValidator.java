package com.herzen.tracker.progress;

/**
 * External gate consulted before a subtask may close for a learner.
 */
public interface CloseValidator {

    CloseCheck mayClose(String taskId, String learnerId);

    record CloseCheck(boolean allowed, String reason) {
        public static CloseCheck allow() {
            return new CloseCheck(true, "");
        }

        public static CloseCheck deny(String reason) {
            return new CloseCheck(false, reason);
        }
    }
}
