package com.coursecast.orchestrator.timeline;

import java.util.List;

/**
 * A timeline broke one or more structural or temporal rules.
 * Carries every violation found, not just the first.
 */
public class TimelineValidationException extends Exception {

    private final List<String> errors;

    public TimelineValidationException(List<String> errors) {
        super("Timeline validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() { return errors; }
}
