package io.tissueflow.fusion;

public final class FusionException extends RuntimeException {

    public enum Reason {
        DATA_INCOMPLETE,
        SHAPE_ERROR
    }

    private final Reason reason;

    public FusionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
