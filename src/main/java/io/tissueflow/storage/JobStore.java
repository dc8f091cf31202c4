package io.tissueflow.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.tissueflow.batch.BatchPaths;
import io.tissueflow.batch.BatchPlanner;
import io.tissueflow.batch.JobDescriptionException;
import io.tissueflow.model.Batch;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);
    private static final String RUN_GLOB = "*_run_*.job.json";
    private static final String COLLECT_GLOB = "*_collect.job.json";

    private final String stepName;
    private final Path directory;
    private final BatchPaths paths;

    public JobStore(String stepName, Path directory, BatchPaths paths) {
        this.stepName = stepName;
        this.directory = directory;
        this.paths = paths;
    }

    public Path directory() {
        return directory;
    }

    public Path runFile(int jobId) {
        return directory.resolve(String.format("%s_run_%06d.job.json", stepName, jobId));
    }

    public Path collectFile() {
        return directory.resolve(stepName + "_collect.job.json");
    }

    public void write(JobDescriptions descriptions) {
        BatchPlanner.validateBatchIds(descriptions.run());
        try {
            if (!Files.exists(directory)) {
                log.debug("create directory for job description files: {}", directory);
                Files.createDirectories(directory);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create job description directory: " + directory, e);
        }
        for (Batch batch : descriptions.run()) {
            Jsons.writeFile(runFile(batch.id()), BatchCodec.toJson(paths.toRelative(batch)));
        }
        descriptions.collectBatch().ifPresent(batch ->
                Jsons.writeFile(collectFile(), BatchCodec.toJson(paths.toRelative(batch))));
        log.info("wrote {} job description file(s) to {}",
                descriptions.run().size() + (descriptions.hasCollect() ? 1 : 0), directory);
    }

    public JobDescriptions readAll() {
        List<Path> runFiles = list(RUN_GLOB);
        if (runFiles.isEmpty()) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.NO_DESCRIPTIONS_FOUND,
                    "No job description files found in " + directory
            );
        }
        List<Batch> run = new ArrayList<>(runFiles.size());
        for (Path file : runFiles) {
            run.add(readRunFile(file));
        }
        run.sort(Comparator.comparing(Batch::id));
        BatchPlanner.validateBatchIds(run);
        List<Path> collectFiles = list(COLLECT_GLOB);
        Batch collect = collectFiles.isEmpty() ? null : read(collectFiles.get(0));
        return new JobDescriptions(run, collect);
    }

    public Batch readRun(int jobId) {
        Batch batch = readRunFile(runFile(jobId));
        if (batch.id() != jobId) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.INVALID_BATCH_ID,
                    "Job description file " + runFile(jobId) + " holds batch " + batch.id() + ", not " + jobId
            );
        }
        return batch;
    }

    public Batch readCollect() {
        return read(collectFile());
    }

    public Batch read(Path file) {
        if (!Files.exists(file)) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MISSING_DESCRIPTION,
                    "Job description file does not exist: " + file
                            + ". Initialize the step first by running \"init\"."
            );
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MALFORMED_SHAPE,
                    "Failed to parse job description file: " + file,
                    e
            );
        }
        return paths.toAbsolute(BatchCodec.fromJson(node, file.getFileName().toString()));
    }

    private Batch readRunFile(Path file) {
        Batch batch = read(file);
        if (batch.id() == null || batch.id() < 1) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MALFORMED_SHAPE,
                    "Run job description needs a positive integer \"id\": " + file
            );
        }
        return batch;
    }

    public int delete() {
        int removed = 0;
        List<Path> files = list(RUN_GLOB);
        files.addAll(list(COLLECT_GLOB));
        for (Path file : files) {
            try {
                if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to delete job description file: " + file, e);
            }
        }
        return removed;
    }

    private List<Path> list(String glob) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list job description files in " + directory, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
