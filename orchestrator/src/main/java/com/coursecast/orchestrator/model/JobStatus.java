package com.coursecast.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle status of a video generation Job.
 *
 * Transitions:
 *   PENDING → PROCESSING → COMPLETED
 *   PROCESSING → FAILED      (permanent error or retry ceiling reached)
 *   PENDING | PROCESSING → CANCELLED  (cancel_requested observed at a stage boundary)
 *   FAILED → PENDING | PROCESSING     (explicit operator retry only)
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Lowercase name used on the wire. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
