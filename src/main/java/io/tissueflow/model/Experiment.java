package io.tissueflow.model;

import java.nio.file.Path;
import java.time.Instant;

public record Experiment(long id, String name, Path root, Instant createdAt) {
    public Experiment {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Experiment name cannot be empty");
        }
        if (root == null) {
            throw new IllegalArgumentException("Experiment root cannot be null");
        }
    }
}
