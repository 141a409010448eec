package com.coursecast.orchestrator.model;

import java.util.Locale;

/**
 * Classification of the most recent failure recorded on a Job.
 *
 * Stored next to error_message so an operator retry can tell a timeline
 * validation failure (needs a fresh submission) from an outage.
 */
public enum FailureKind {
    TRANSIENT,
    VALIDATION,
    EXTERNAL_SERVICE,
    INTERNAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
