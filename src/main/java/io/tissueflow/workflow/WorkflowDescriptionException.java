package io.tissueflow.workflow;

public final class WorkflowDescriptionException extends RuntimeException {

    public enum Reason {
        UNKNOWN_STAGE,
        UNKNOWN_STEP,
        DUPLICATE_STAGE,
        DUPLICATE_STEP,
        ORDER_VIOLATION,
        INCOMPLETE_STAGE,
        MISSING_UPSTREAM_STEP
    }

    private final Reason reason;

    public WorkflowDescriptionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
