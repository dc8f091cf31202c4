package io.tissueflow.storage;

import io.tissueflow.config.TissueFlowConfig;
import io.tissueflow.model.Experiment;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

final class SqliteExperimentStoreTest {

    @Test
    void experimentsAndSubmissionsRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-store-");
        try {
            SqliteExperimentStore store = store(root);

            Experiment experiment = store.createExperiment("plate1", root.resolve("experiments"));

            Assertions.assertTrue(Files.isDirectory(experiment.root()));
            Assertions.assertEquals(experiment.root(), store.experimentRootPath(experiment.id()));
            Assertions.assertEquals("plate1", store.findExperiment(experiment.id()).orElseThrow().name());

            Submission first = store.createSubmissionRecord(experiment.id(), "align");
            Submission second = store.createSubmissionRecord(experiment.id(), "align");
            Assertions.assertNotEquals(first.id(), second.id());
            Assertions.assertEquals(second.id(), store.latestSubmission(experiment.id(), "align").orElseThrow().id());
            Assertions.assertTrue(store.latestSubmission(experiment.id(), "jterator").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void jobStatusIsUpsertedPerJob() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-store-status-");
        try {
            SqliteExperimentStore store = store(root);
            Experiment experiment = store.createExperiment("plate2", root.resolve("experiments"));
            Submission submission = store.createSubmissionRecord(experiment.id(), "align");

            store.recordJobStatus(submission.id(), status("align_run_000001", 1, JobPhase.RUN, JobState.RUNNING, null));
            store.recordJobStatus(submission.id(), status("align_run_000001", 1, JobPhase.RUN, JobState.TERMINATED, 3));
            store.recordJobStatus(submission.id(), status("align_collect", null, JobPhase.COLLECT, JobState.STOPPED, null));

            List<JobStatus> statuses = store.jobStatuses(submission.id());
            Assertions.assertEquals(2, statuses.size());
            JobStatus run = statuses.get(0);
            Assertions.assertEquals("align_run_000001", run.jobName());
            Assertions.assertEquals(JobState.TERMINATED, run.state());
            Assertions.assertEquals(3, run.exitCode());
            Assertions.assertEquals(Duration.ofSeconds(12), run.elapsedTime());
            Assertions.assertTrue(run.failed());
            JobStatus collect = statuses.get(1);
            Assertions.assertNull(collect.jobId());
            Assertions.assertNull(collect.exitCode());
            Assertions.assertEquals(JobState.STOPPED, collect.state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteExperimentRemovesRecordAndDirectory() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-store-delete-");
        try {
            SqliteExperimentStore store = store(root);
            Experiment experiment = store.createExperiment("plate3", root.resolve("experiments"));
            Files.writeString(experiment.root().resolve("notes.txt"), "x");
            store.createSubmissionRecord(experiment.id(), "align");

            store.deleteExperiment(experiment.id());

            Assertions.assertFalse(Files.exists(experiment.root()));
            Assertions.assertTrue(store.findExperiment(experiment.id()).isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.experimentRootPath(experiment.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteExperimentStore store(Path root) {
        Database db = new Database(TissueFlowConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteExperimentStore(db);
    }

    private static JobStatus status(String name, Integer id, JobPhase phase, JobState state, Integer exitCode) {
        return new JobStatus(name, id, phase, state, exitCode, Duration.ofSeconds(12), Duration.ofSeconds(4), 128L);
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
