package io.tissueflow.model;

public enum JobPhase {
    RUN,
    COLLECT
}
