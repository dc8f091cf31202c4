package io.tissueflow.model;

import java.time.Duration;

public record JobStatus(
        String jobName,
        Integer jobId,
        JobPhase phase,
        JobState state,
        Integer exitCode,
        Duration elapsedTime,
        Duration cpuTime,
        long maxMemoryMb
) {
    /**
     * Value of {@code maxMemoryMb} when the engine does not measure peak memory.
     */
    public static final long UNKNOWN_MEMORY_MB = -1L;

    public JobStatus {
        if (state == null) {
            state = JobState.CREATED;
        }
        elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
        cpuTime = cpuTime == null ? Duration.ZERO : cpuTime;
    }

    public static JobStatus created(Job job) {
        return new JobStatus(job.name(), job.jobId(), job.phase(), JobState.CREATED, null, null, null, UNKNOWN_MEMORY_MB);
    }

    public boolean failed() {
        if (state == JobState.STOPPED) {
            return true;
        }
        return state == JobState.TERMINATED && exitCode != null && exitCode != 0;
    }
}
