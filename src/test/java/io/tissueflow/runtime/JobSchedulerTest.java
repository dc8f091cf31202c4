package io.tissueflow.runtime;

import io.tissueflow.model.Batch;
import io.tissueflow.model.Job;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class JobSchedulerTest {

    @Test
    void failingRunJobDoesNotEndTheLoopEarly() throws Exception {
        Submission submission = new Submission(11L, 1L, "jterator", Instant.now());
        JobCollection jobs = collection(submission, 5, false);
        ScriptedEngine engine = new ScriptedEngine(Map.of("jterator_run_000003", 1));
        AtomicInteger calls = new AtomicInteger();

        SubmissionReport report = new JobScheduler(engine, Duration.ZERO,
                (collection, statuses, elapsed) -> calls.incrementAndGet()).submit(jobs, 4);

        Assertions.assertEquals(4, engine.maxInFlight);
        Assertions.assertEquals(11L, report.submissionId());
        Assertions.assertEquals(5, report.statuses().size());
        Assertions.assertEquals(1, report.failures().size());
        Assertions.assertEquals("jterator_run_000003", report.failures().get(0).jobName());
        Assertions.assertEquals(1, report.failures().get(0).exitCode());
        Assertions.assertEquals(JobState.TERMINATED, report.state());
        for (Job job : jobs.runJobs()) {
            Assertions.assertEquals(JobState.TERMINATED, job.state());
        }
        Assertions.assertEquals(3, calls.get());
    }

    @Test
    void collectJobIsStoppedAfterFailedRunJob() throws Exception {
        Submission submission = new Submission(15L, 1L, "jterator", Instant.now());
        JobCollection jobs = collection(submission, 3, true);
        ScriptedEngine engine = new ScriptedEngine(Map.of("jterator_run_000002", 2));

        SubmissionReport report = new JobScheduler(engine, Duration.ZERO, null).submit(jobs);

        Assertions.assertEquals(2, report.failures().size());
        Assertions.assertEquals(JobState.STOPPED, jobs.collectJob().orElseThrow().state());
        Assertions.assertEquals(JobState.STOPPED, report.state());
        Assertions.assertFalse(engine.collectStartedAfterRunJobs);
        Assertions.assertThrows(IllegalStateException.class,
                () -> jobs.addRunJob(collection(submission, 1, false).runJobs().get(0)));
    }

    @Test
    void successfulSubmissionReportsNoFailures() throws Exception {
        Submission submission = new Submission(12L, 1L, "jterator", Instant.now());
        JobCollection jobs = collection(submission, 3, true);
        ScriptedEngine engine = new ScriptedEngine(Map.of());

        SubmissionReport report = new JobScheduler(engine, Duration.ZERO, null).submit(jobs);

        Assertions.assertEquals(JobScheduler.DEFAULT_SUBMIT_CAP, engine.maxInFlight);
        Assertions.assertFalse(report.hasFailures());
        Assertions.assertEquals(JobState.TERMINATED, report.state());
        Assertions.assertTrue(engine.collectStartedAfterRunJobs);
    }

    @Test
    void engineExceptionReachesTheCaller() {
        Submission submission = new Submission(13L, 1L, "jterator", Instant.now());
        JobCollection jobs = collection(submission, 2, false);
        ExecutionEngineException failure = new ExecutionEngineException("backend unavailable");
        ScriptedEngine engine = new ScriptedEngine(Map.of()) {
            @Override
            public void progress() {
                throw failure;
            }
        };

        ExecutionEngineException thrown = Assertions.assertThrows(
                ExecutionEngineException.class,
                () -> new JobScheduler(engine, Duration.ZERO, null).submit(jobs)
        );
        Assertions.assertSame(failure, thrown);
    }

    @Test
    void invalidSubmissionsAreRejected() {
        Submission submission = new Submission(14L, 1L, "jterator", Instant.now());
        JobScheduler scheduler = new JobScheduler(new ScriptedEngine(Map.of()), Duration.ZERO, null);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.submit(collection(submission, 1, false), 0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.submit(new JobCollection("jterator", submission)));
    }

    private static JobCollection collection(Submission submission, int runJobs, boolean withCollect) {
        JobCollection jobs = new JobCollection("jterator", submission);
        for (int id = 1; id <= runJobs; id++) {
            jobs.addRunJob(new Job(
                    String.format("jterator_run_%06d", id),
                    JobPhase.RUN,
                    Batch.run(id, Map.of(), Map.of()),
                    List.of("jterator", "1", "run", "--job", String.valueOf(id)),
                    null,
                    null,
                    null,
                    submission
            ));
        }
        if (withCollect) {
            jobs.setCollectJob(new Job(
                    "jterator_collect",
                    JobPhase.COLLECT,
                    Batch.collect(Map.of(), Map.of(), List.of()),
                    List.of("jterator", "1", "collect"),
                    null,
                    null,
                    null,
                    submission
            ));
        }
        return jobs;
    }

    /**
     * Advances each job by one state per progress call. The collect job waits
     * for all run jobs and is stopped when any of them failed.
     */
    private static class ScriptedEngine implements ExecutionEngine {
        private final Map<String, Integer> exitCodes;
        private final Map<Job, JobState> states = new LinkedHashMap<>();
        private final Map<Job, Integer> codes = new HashMap<>();
        private int maxInFlight;
        private boolean collectStartedAfterRunJobs;

        private ScriptedEngine(Map<String, Integer> exitCodes) {
            this.exitCodes = exitCodes;
        }

        @Override
        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        @Override
        public void submit(Job job) {
            states.put(job, JobState.SUBMITTED);
        }

        @Override
        public void progress() {
            List<Job> runJobs = new ArrayList<>();
            for (Job job : states.keySet()) {
                if (job.phase() == JobPhase.RUN) {
                    runJobs.add(job);
                }
            }
            boolean runPhaseDone = runJobs.stream().allMatch(job -> states.get(job).isTerminal());
            boolean runPhaseFailed = runJobs.stream().anyMatch(job -> codes.getOrDefault(job, 0) != 0);
            for (Map.Entry<Job, JobState> entry : states.entrySet()) {
                Job job = entry.getKey();
                JobState state = entry.getValue();
                if (state.isTerminal()) {
                    continue;
                }
                if (job.phase() == JobPhase.COLLECT) {
                    if (!runPhaseDone) {
                        continue;
                    }
                    if (runPhaseFailed) {
                        entry.setValue(JobState.STOPPED);
                        continue;
                    }
                    collectStartedAfterRunJobs = true;
                }
                if (state == JobState.SUBMITTED) {
                    entry.setValue(JobState.RUNNING);
                } else {
                    entry.setValue(JobState.TERMINATED);
                    codes.put(job, exitCodes.getOrDefault(job.name(), 0));
                }
            }
        }

        @Override
        public JobStatus statusOf(Job job) {
            return new JobStatus(job.name(), job.jobId(), job.phase(), states.get(job), codes.get(job),
                    Duration.ZERO, Duration.ZERO, 0L);
        }
    }
}
