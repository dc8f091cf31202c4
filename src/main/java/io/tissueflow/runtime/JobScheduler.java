package io.tissueflow.runtime;

import io.tissueflow.model.Job;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Submits the jobs of one step to an {@link ExecutionEngine} and polls until
 * all of them reached a terminal state.
 *
 * <p>A failing job never ends the loop early. Exceptions thrown by the engine
 * reach the caller unchanged.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public static final int DEFAULT_SUBMIT_CAP = 2000;

    private final ExecutionEngine engine;
    private final Duration monitoringInterval;
    private final ProgressListener listener;

    public JobScheduler(ExecutionEngine engine, Duration monitoringInterval, ProgressListener listener) {
        if (engine == null) {
            throw new IllegalArgumentException("Execution engine cannot be null");
        }
        this.engine = engine;
        this.monitoringInterval = monitoringInterval == null || monitoringInterval.isNegative()
                ? Duration.ZERO
                : monitoringInterval;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    public SubmissionReport submit(JobCollection jobs) throws InterruptedException {
        return submit(jobs, DEFAULT_SUBMIT_CAP);
    }

    public SubmissionReport submit(JobCollection jobs, int submitCap) throws InterruptedException {
        if (submitCap <= 0) {
            throw new IllegalArgumentException("Submit cap must be positive: " + submitCap);
        }
        if (jobs.all().isEmpty()) {
            throw new IllegalArgumentException("No jobs to submit for step \"" + jobs.stepName() + "\"");
        }
        log.debug("monitoring interval: {} ms", monitoringInterval.toMillis());
        log.debug("set maximum number of submitted jobs to {}", submitCap);
        engine.setMaxInFlight(submitCap);

        log.debug("add {} job(s) of step \"{}\" to engine", jobs.all().size(), jobs.stepName());
        for (Job job : jobs.all()) {
            engine.submit(job);
        }

        long started = System.nanoTime();
        boolean breakNext = false;
        while (true) {
            Thread.sleep(monitoringInterval.toMillis());
            log.debug("progress...");
            engine.progress();

            List<JobStatus> statuses = refresh(jobs);
            listener.onProgress(jobs, statuses, Duration.ofNanos(System.nanoTime() - started));

            if (breakNext) {
                break;
            }
            if (jobs.state().isTerminal()) {
                breakNext = true;
                engine.progress();
            }
        }

        List<JobStatus> statuses = refresh(jobs);
        List<JobStatus> failures = new ArrayList<>();
        for (JobStatus status : statuses) {
            if (status.failed()) {
                failures.add(status);
            }
        }
        logFailures(failures);
        JobState state = jobs.state();
        log.info("step \"{}\" finished with state {}", jobs.stepName(), state);
        return new SubmissionReport(
                jobs.submission() == null ? 0L : jobs.submission().id(),
                state,
                statuses,
                failures
        );
    }

    private List<JobStatus> refresh(JobCollection jobs) {
        List<JobStatus> statuses = new ArrayList<>();
        for (Job job : jobs.all()) {
            JobStatus status = engine.statusOf(job);
            job.update(status);
            statuses.add(status);
        }
        return statuses;
    }

    private static void logFailures(List<JobStatus> failures) {
        for (JobStatus status : failures) {
            if (status.state() == JobState.STOPPED) {
                log.warn("job \"{}\" was stopped", status.jobName());
            } else {
                log.warn("job \"{}\" failed with exit code {}", status.jobName(), status.exitCode());
            }
        }
        if (failures.isEmpty()) {
            log.info("all jobs completed successfully");
        } else {
            log.warn("{} job(s) failed", failures.size());
        }
    }
}
