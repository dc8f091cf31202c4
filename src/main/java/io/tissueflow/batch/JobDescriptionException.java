package io.tissueflow.batch;

public final class JobDescriptionException extends RuntimeException {

    public enum Reason {
        NO_DESCRIPTIONS_FOUND,
        MISSING_DESCRIPTION,
        MALFORMED_SHAPE,
        INVALID_BATCH_ID
    }

    private final Reason reason;

    public JobDescriptionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public JobDescriptionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
