package com.coursecast.orchestrator.client;

/**
 * Thrown when an external collaborator (Gemini, TTS, renderer, PDF parser)
 * fails. {@link #isTransient()} says whether trying again later could help:
 * timeouts, connection errors, HTTP 408/429/5xx are transient; anything else
 * is a permanent answer from the collaborator.
 */
public class CollaboratorException extends RuntimeException {

    private final boolean transientFailure;
    private final int statusCode;

    public CollaboratorException(String message, boolean transientFailure) {
        this(message, transientFailure, -1, null);
    }

    public CollaboratorException(String message, boolean transientFailure, Throwable cause) {
        this(message, transientFailure, -1, cause);
    }

    public CollaboratorException(String message, boolean transientFailure, int statusCode, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.statusCode       = statusCode;
    }

    public static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    public boolean isTransient() { return transientFailure; }

    /** HTTP status, or -1 when the failure did not come from an HTTP response. */
    public int statusCode()      { return statusCode; }
}
