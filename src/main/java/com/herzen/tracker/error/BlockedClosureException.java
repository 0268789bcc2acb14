package com.herzen.tracker.error;

import java.util.List;
import java.util.Map;

/**
 * A parent cannot close while any direct child is still open for the same learner.
 */
public class BlockedClosureException extends TrackerException {
    private final String taskId;
    private final List<String> openChildren;

    public BlockedClosureException(String taskId, List<String> openChildren) {
        super(ErrorKind.BLOCKED_CLOSURE, "Cannot close task " + taskId + ": children not closed " + openChildren);
        this.taskId = taskId;
        this.openChildren = List.copyOf(openChildren);
    }

    public List<String> openChildren() {
        return openChildren;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId, "openChildren", openChildren);
    }
}
