package io.tissueflow.model;

/**
 * Lifecycle of a job: {@code CREATED -> SUBMITTED -> RUNNING -> TERMINATED | STOPPED}.
 * States only move forward; a poll may skip an intermediate state.
 */
public enum JobState {
    CREATED,
    SUBMITTED,
    RUNNING,
    TERMINATED,
    STOPPED;

    public boolean isTerminal() {
        return this == TERMINATED || this == STOPPED;
    }

    public boolean canAdvanceTo(JobState next) {
        if (next == this) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        return next.ordinal() > ordinal();
    }
}
