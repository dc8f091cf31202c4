package io.tissueflow.batch;

import io.tissueflow.config.ExperimentLayout;
import io.tissueflow.fusion.Dataset;
import io.tissueflow.fusion.JsonFragmentStore;
import io.tissueflow.model.Batch;
import io.tissueflow.model.Job;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.PathList;
import io.tissueflow.model.Submission;
import io.tissueflow.workflow.StepName;
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
import java.util.stream.Stream;

final class FileBatchPlannerTest {

    @Test
    void inputFilesArePartitionedIntoDenseBatches() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-planner-");
        try {
            writeImages(root.resolve("images"), 25);
            FileBatchPlanner planner = planner(root, 0);

            JobDescriptions descriptions = planner.plan(Map.of("input_dir", "images", "batch_size", 10));

            Assertions.assertEquals(3, descriptions.run().size());
            Assertions.assertEquals(List.of(1, 2, 3), descriptions.run().stream().map(Batch::id).toList());
            Assertions.assertEquals(10, descriptions.run().get(0).inputFiles().size());
            Assertions.assertEquals(5, descriptions.run().get(2).inputFiles().size());
            Assertions.assertEquals(
                    planner.layout().dataDir("jterator").resolve("jterator_000002.data.json"),
                    descriptions.run().get(1).outputFiles().get(0)
            );

            Batch collect = descriptions.collectBatch().orElseThrow();
            Assertions.assertTrue(collect.isCollect());
            Assertions.assertEquals(3, collect.inputFiles().size());
            Assertions.assertEquals(List.of(planner.dataFile()), collect.outputFiles());
            Assertions.assertEquals(List.of(FileBatchPlanner.DATA_FILES), collect.removals());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fuseCanBeDisabled() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-planner-nofuse-");
        try {
            writeImages(root.resolve("images"), 3);

            JobDescriptions descriptions = planner(root, 0)
                    .plan(Map.of("input_dir", "images", "fuse", "false"));

            Assertions.assertEquals(1, descriptions.run().size());
            Assertions.assertFalse(descriptions.hasCollect());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void commandsAndJobNamesFollowTheStep() {
        FileBatchPlanner planner = planner(Path.of("/tmp/unused"), 2);
        Batch batch = Batch.run(7, Map.of(), Map.of());

        Assertions.assertEquals(
                List.of("jterator", "-v", "-v", "42", "run", "--job", "7"),
                planner.buildRunCommand(batch)
        );
        Assertions.assertEquals(List.of("jterator", "-v", "-v", "42", "collect"), planner.buildCollectCommand());
        Assertions.assertEquals("jterator_run_000007", planner.runJobName(7));
        Assertions.assertEquals("jterator_collect", planner.collectJobName());
    }

    @Test
    void createJobsAppliesResourcesAndRejectsNonPositiveCores() {
        FileBatchPlanner planner = planner(Path.of("/tmp/unused"), 0);
        Submission submission = new Submission(9L, 42L, "jterator", Instant.now());
        JobDescriptions descriptions = new JobDescriptions(
                List.of(Batch.run(1, Map.of(), Map.of()), Batch.run(2, Map.of(), Map.of())),
                Batch.collect(Map.of(), Map.of(), List.of())
        );

        JobCollection jobs = planner.createJobs(
                descriptions,
                submission,
                new JobResources(Duration.ofMinutes(30), 2048L, 2)
        );

        Assertions.assertEquals(2, jobs.runJobs().size());
        Job first = jobs.runJobs().get(0);
        Assertions.assertEquals(Duration.ofMinutes(30), first.requestedWalltime());
        Assertions.assertEquals(2, first.requestedCores());
        Job collect = jobs.collectJob().orElseThrow();
        Assertions.assertEquals(JobPhase.COLLECT, collect.phase());
        Assertions.assertEquals(Duration.ofHours(2), collect.requestedWalltime());
        Assertions.assertEquals(4000L, collect.requestedMemoryMb());

        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> planner.createJobs(descriptions, submission, new JobResources(null, null, 0))
        );
    }

    @Test
    void batchIdsMustBeDenseAndUnique() {
        JobDescriptionException gap = Assertions.assertThrows(
                JobDescriptionException.class,
                () -> BatchPlanner.validateBatchIds(List.of(Batch.run(1, Map.of(), Map.of()), Batch.run(3, Map.of(), Map.of())))
        );
        Assertions.assertEquals(JobDescriptionException.Reason.INVALID_BATCH_ID, gap.reason());

        JobDescriptionException duplicate = Assertions.assertThrows(
                JobDescriptionException.class,
                () -> BatchPlanner.validateBatchIds(List.of(Batch.run(1, Map.of(), Map.of()), Batch.run(1, Map.of(), Map.of())))
        );
        Assertions.assertEquals(JobDescriptionException.Reason.INVALID_BATCH_ID, duplicate.reason());

        Assertions.assertEquals(List.of(List.of(1, 2), List.of(3)), BatchPlanner.partition(List.of(1, 2, 3), 2));
    }

    @Test
    void runJobsWriteFragmentsThatTheCollectJobFuses() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-planner-collect-");
        try {
            writeImages(root.resolve("images"), 7);
            FileBatchPlanner planner = planner(root, 0);
            planner.initialize();
            JobDescriptions descriptions = planner.plan(Map.of("input_dir", "images", "batch_size", 3));

            for (Batch batch : descriptions.run()) {
                planner.runJob(batch);
            }
            planner.collectJobOutput(descriptions.collectBatch().orElseThrow());

            try (JsonFragmentStore fused = JsonFragmentStore.open(planner.dataFile())) {
                Assertions.assertEquals(List.of(3), fused.dimensions("metadata/job_id"));
                Assertions.assertEquals(Dataset.longs(1, 2, 3), fused.read("metadata/job_id"));
                Assertions.assertEquals(Dataset.longs(3, 3, 1), fused.read("metadata/file_count"));
                Assertions.assertEquals(Dataset.longs(1, 2, 3, 1, 2, 3, 1),
                        fused.read("objects/files/segmentation/object_ids"));
                Assertions.assertEquals("image_004.png",
                        fused.read("objects/files/features/file_name").values().get(4));
            }
            for (Path fragment : ((PathList) descriptions.collect().inputs().get(FileBatchPlanner.DATA_FILES)).paths()) {
                Assertions.assertFalse(Files.exists(fragment));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void teardownRemovesTheStepDirectory() throws Exception {
        Path root = Files.createTempDirectory("tissueflow-test-planner-teardown-");
        try {
            FileBatchPlanner planner = planner(root, 0);
            planner.initialize();
            Assertions.assertTrue(Files.isDirectory(planner.jobDescriptionsDir()));
            Assertions.assertTrue(Files.isDirectory(planner.logDir()));

            planner.teardown();

            Assertions.assertFalse(Files.exists(planner.stepDir()));
        } finally {
            deleteRecursively(root);
        }
    }

    private static FileBatchPlanner planner(Path root, int verbosity) {
        return new FileBatchPlanner(42L, StepName.JTERATOR, new ExperimentLayout(root), verbosity);
    }

    private static void writeImages(Path dir, int count) throws IOException {
        Files.createDirectories(dir);
        for (int i = 0; i < count; i++) {
            Files.writeString(dir.resolve(String.format("image_%03d.png", i)), "x".repeat(i + 1), StandardCharsets.UTF_8);
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
