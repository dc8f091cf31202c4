package io.tissueflow.runtime;

import io.tissueflow.model.Job;
import io.tissueflow.model.JobStatus;

/**
 * Runs submitted jobs. The scheduler only drives it through
 * {@link #progress()} and observes the result through {@link #statusOf(Job)}.
 *
 * <p>An engine must not start the collect job of a submission before every
 * run job of that submission is terminal.
 */
public interface ExecutionEngine {
    void setMaxInFlight(int maxInFlight);

    void submit(Job job);

    void progress();

    JobStatus statusOf(Job job);
}
