package io.tissueflow.model;

import java.time.Instant;

public record Submission(long id, long experimentId, String program, Instant createdAt) {
    public Submission {
        if (program == null || program.isBlank()) {
            throw new IllegalArgumentException("Submission program cannot be empty");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
