package io.tissueflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class JobCollection {
    private final String stepName;
    private final Submission submission;
    private final List<Job> runJobs = new ArrayList<>();
    private Job collectJob;

    public JobCollection(String stepName, Submission submission) {
        this.stepName = stepName;
        this.submission = submission;
    }

    public String stepName() {
        return stepName;
    }

    public Submission submission() {
        return submission;
    }

    public synchronized void addRunJob(Job job) {
        ensureOpen(job);
        if (job.phase() != JobPhase.RUN) {
            throw new IllegalArgumentException("Not a run job: " + job.name());
        }
        runJobs.add(job);
    }

    public synchronized void setCollectJob(Job job) {
        ensureOpen(job);
        if (job.phase() != JobPhase.COLLECT) {
            throw new IllegalArgumentException("Not a collect job: " + job.name());
        }
        if (collectJob != null) {
            throw new IllegalStateException("Collect job already set for step " + stepName);
        }
        collectJob = job;
    }

    public synchronized List<Job> runJobs() {
        return Collections.unmodifiableList(new ArrayList<>(runJobs));
    }

    public synchronized Optional<Job> collectJob() {
        return Optional.ofNullable(collectJob);
    }

    public synchronized List<Job> all() {
        List<Job> out = new ArrayList<>(runJobs);
        if (collectJob != null) {
            out.add(collectJob);
        }
        return out;
    }

    /**
     * Aggregate state: the least advanced non-terminal state of any job, else
     * STOPPED if any job stopped, else TERMINATED. An empty collection is
     * CREATED.
     */
    public synchronized JobState state() {
        List<Job> jobs = all();
        if (jobs.isEmpty()) {
            return JobState.CREATED;
        }
        JobState least = null;
        boolean anyStopped = false;
        for (Job job : jobs) {
            JobState state = job.state();
            if (state == JobState.STOPPED) {
                anyStopped = true;
            } else if (!state.isTerminal() && (least == null || state.ordinal() < least.ordinal())) {
                least = state;
            }
        }
        if (least != null) {
            return least;
        }
        return anyStopped ? JobState.STOPPED : JobState.TERMINATED;
    }

    private void ensureOpen(Job job) {
        if (!all().isEmpty() && state().isTerminal()) {
            throw new IllegalStateException(
                    "Cannot add job " + job.name() + " to terminated submission " + describe(submission)
            );
        }
        if (job.submission() != null && (submission == null || job.submission().id() != submission.id())) {
            throw new IllegalArgumentException(
                    "Job " + job.name() + " belongs to submission " + job.submission().id()
                            + ", not " + describe(submission)
            );
        }
    }

    private static String describe(Submission submission) {
        return submission == null ? "<none>" : String.valueOf(submission.id());
    }
}
