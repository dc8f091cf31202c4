package io.tissueflow.batch;

import java.time.Duration;

public record JobResources(Duration walltime, Long memoryMb, Integer cores) {
    public JobResources {
        if (cores != null && cores <= 0) {
            throw new IllegalArgumentException("The value of \"cores\" must be positive.");
        }
        if (memoryMb != null && memoryMb <= 0) {
            throw new IllegalArgumentException("The value of \"memory\" must be positive.");
        }
    }

    public static JobResources unspecified() {
        return new JobResources(null, null, null);
    }
}
