package com.coursecast.orchestrator.stage;

import com.coursecast.orchestrator.model.FailureKind;

/**
 * A stage executor's classified failure. The executor only says what went
 * wrong; whether the job retries or fails is decided by the orchestrator.
 */
public class StageException extends RuntimeException {

    public enum Kind {
        /** Timeouts, rate limits, I/O: the same call may succeed later. */
        TRANSIENT,
        /** Output broke a structural or timing rule. Never retried in place. */
        VALIDATION,
        /** A collaborator gave a permanent error. */
        EXTERNAL_SERVICE
    }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean retryable() {
        return kind == Kind.TRANSIENT;
    }

    public FailureKind failureKind() {
        return switch (kind) {
            case TRANSIENT        -> FailureKind.TRANSIENT;
            case VALIDATION       -> FailureKind.VALIDATION;
            case EXTERNAL_SERVICE -> FailureKind.EXTERNAL_SERVICE;
        };
    }
}
