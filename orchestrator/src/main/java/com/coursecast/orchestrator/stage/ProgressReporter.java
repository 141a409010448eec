package com.coursecast.orchestrator.stage;

/** Advisory 0-100 progress within the running stage. */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NONE = percent -> {};

    void report(int percent);
}
