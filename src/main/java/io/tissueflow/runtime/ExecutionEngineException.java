package io.tissueflow.runtime;

public final class ExecutionEngineException extends RuntimeException {
    public ExecutionEngineException(String message) {
        super(message);
    }

    public ExecutionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
