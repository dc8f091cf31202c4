package io.tissueflow.runtime;

import io.tissueflow.model.Batch;
import io.tissueflow.model.Job;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class LocalProcessEngineTest {
    private static final Submission SUBMISSION = new Submission(5L, 1L, "jterator", Instant.now());

    @Test
    void collectJobStartsAfterAllRunJobsTerminated() throws Exception {
        Path dir = Files.createTempDirectory("tissueflow-test-engine-");
        try (LocalProcessEngine engine = new LocalProcessEngine(List.of(), dir.resolve("log"), dir)) {
            Job first = runJob(1, "sleep 0.3; echo one > run_1.txt", null);
            Job second = runJob(2, "echo two > run_2.txt", null);
            Job collect = collectJob("test -f run_1.txt && test -f run_2.txt && echo done > collected.txt");
            engine.submit(first);
            engine.submit(second);
            engine.submit(collect);

            awaitTerminal(engine, collect);

            Assertions.assertEquals(JobState.TERMINATED, engine.statusOf(first).state());
            Assertions.assertEquals(JobState.TERMINATED, engine.statusOf(collect).state());
            Assertions.assertEquals(0, engine.statusOf(collect).exitCode());
            Assertions.assertEquals("done", Files.readString(dir.resolve("collected.txt"), StandardCharsets.UTF_8).trim());

            Optional<JobLogs> logs = JobLogs.latest(dir.resolve("log"), "jterator_collect");
            Assertions.assertTrue(logs.isPresent());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void failedRunJobStopsCollectWithoutStartingIt() throws Exception {
        Path dir = Files.createTempDirectory("tissueflow-test-engine-failed-");
        try (LocalProcessEngine engine = new LocalProcessEngine(List.of(), dir.resolve("log"), dir)) {
            Job ok = runJob(1, "exit 0", null);
            Job failing = runJob(2, "echo broken >&2; exit 3", null);
            Job collect = collectJob("echo started > collected.txt");
            engine.submit(ok);
            engine.submit(failing);
            engine.submit(collect);

            awaitTerminal(engine, collect);

            Assertions.assertEquals(3, engine.statusOf(failing).exitCode());
            Assertions.assertEquals(JobStatus.UNKNOWN_MEMORY_MB, engine.statusOf(ok).maxMemoryMb());
            Assertions.assertTrue(engine.statusOf(failing).failed());
            Assertions.assertEquals(JobState.STOPPED, engine.statusOf(collect).state());
            Assertions.assertFalse(Files.exists(dir.resolve("collected.txt")));
            JobLogs logs = JobLogs.latest(dir.resolve("log"), "jterator_run_000002").orElseThrow();
            Assertions.assertEquals("broken", logs.stderr().trim());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void jobOverItsWallTimeIsStopped() throws Exception {
        Path dir = Files.createTempDirectory("tissueflow-test-engine-walltime-");
        try (LocalProcessEngine engine = new LocalProcessEngine(List.of(), dir.resolve("log"), dir)) {
            Job slow = runJob(1, "sleep 30", Duration.ofMillis(200));
            engine.submit(slow);

            awaitTerminal(engine, slow);

            Assertions.assertEquals(JobState.STOPPED, engine.statusOf(slow).state());
            Assertions.assertTrue(engine.statusOf(slow).failed());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void inFlightCapLimitsStartedJobs() throws Exception {
        Path dir = Files.createTempDirectory("tissueflow-test-engine-cap-");
        try (LocalProcessEngine engine = new LocalProcessEngine(List.of(), dir.resolve("log"), dir)) {
            engine.setMaxInFlight(1);
            Job first = runJob(1, "sleep 0.5", null);
            Job second = runJob(2, "exit 0", null);
            engine.submit(first);
            engine.submit(second);

            engine.progress();

            Assertions.assertEquals(JobState.RUNNING, engine.statusOf(first).state());
            Assertions.assertEquals(JobState.SUBMITTED, engine.statusOf(second).state());
            awaitTerminal(engine, second);
            Assertions.assertEquals(JobState.TERMINATED, engine.statusOf(first).state());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void unknownJobIsAnEngineError() throws Exception {
        Path dir = Files.createTempDirectory("tissueflow-test-engine-unknown-");
        try (LocalProcessEngine engine = new LocalProcessEngine(List.of(), dir.resolve("log"), dir)) {
            Job job = runJob(1, "exit 0", null);

            Assertions.assertThrows(ExecutionEngineException.class, () -> engine.statusOf(job));
            engine.submit(job);
            Assertions.assertThrows(ExecutionEngineException.class, () -> engine.submit(job));
            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.setMaxInFlight(0));
        } finally {
            deleteRecursively(dir);
        }
    }

    private static Job runJob(int id, String script, Duration walltime) {
        return new Job(
                String.format("jterator_run_%06d", id),
                JobPhase.RUN,
                Batch.run(id, Map.of(), Map.of()),
                List.of("sh", "-c", script),
                walltime,
                null,
                null,
                SUBMISSION
        );
    }

    private static Job collectJob(String script) {
        return new Job(
                "jterator_collect",
                JobPhase.COLLECT,
                Batch.collect(Map.of(), Map.of(), List.of()),
                List.of("sh", "-c", script),
                null,
                null,
                null,
                SUBMISSION
        );
    }

    private static void awaitTerminal(LocalProcessEngine engine, Job job) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 20_000L;
        while (!engine.statusOf(job).state().isTerminal()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("job did not finish in time: " + job.name());
            }
            engine.progress();
            Thread.sleep(50L);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
