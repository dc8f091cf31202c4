package io.tissueflow.model;

import java.time.Duration;
import java.util.List;

public final class Job {
    private final String name;
    private final JobPhase phase;
    private final Batch batch;
    private final List<String> command;
    private final Duration requestedWalltime;
    private final Long requestedMemoryMb;
    private final Integer requestedCores;
    private final Submission submission;
    private volatile JobStatus status;

    public Job(
            String name,
            JobPhase phase,
            Batch batch,
            List<String> command,
            Duration requestedWalltime,
            Long requestedMemoryMb,
            Integer requestedCores,
            Submission submission
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Job command cannot be empty: " + name);
        }
        if (requestedCores != null && requestedCores <= 0) {
            throw new IllegalArgumentException("The value of \"cores\" must be positive: " + requestedCores);
        }
        if (requestedMemoryMb != null && requestedMemoryMb <= 0) {
            throw new IllegalArgumentException("The value of \"memory\" must be positive: " + requestedMemoryMb);
        }
        this.name = name;
        this.phase = phase;
        this.batch = batch;
        this.command = List.copyOf(command);
        this.requestedWalltime = requestedWalltime;
        this.requestedMemoryMb = requestedMemoryMb;
        this.requestedCores = requestedCores;
        this.submission = submission;
        this.status = JobStatus.created(this);
    }

    public String name() {
        return name;
    }

    public JobPhase phase() {
        return phase;
    }

    public Integer jobId() {
        return batch == null ? null : batch.id();
    }

    public Batch batch() {
        return batch;
    }

    public List<String> command() {
        return command;
    }

    public Duration requestedWalltime() {
        return requestedWalltime;
    }

    public Long requestedMemoryMb() {
        return requestedMemoryMb;
    }

    public Integer requestedCores() {
        return requestedCores;
    }

    public Submission submission() {
        return submission;
    }

    public JobStatus status() {
        return status;
    }

    public JobState state() {
        return status.state();
    }

    public void update(JobStatus next) {
        JobState current = status.state();
        if (!current.canAdvanceTo(next.state())) {
            throw new IllegalStateException(
                    "Illegal state transition for job " + name + ": " + current + " -> " + next.state()
            );
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "Job{name=" + name + ", state=" + status.state() + "}";
    }
}
