package com.herzen.tracker.error;

import java.util.Map;

/**
 * Business-rule rejection. Never retried by the engine; callers surface {@link #kind()}
 * and {@link #details()} to whoever asked.
 */
public abstract class TrackerException extends RuntimeException {
    private final ErrorKind kind;

    protected TrackerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public abstract Map<String, Object> details();
}
