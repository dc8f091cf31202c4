package io.tissueflow.batch;

import io.tissueflow.config.ExperimentLayout;
import io.tissueflow.config.SchedulerSettings;
import io.tissueflow.model.Batch;
import io.tissueflow.model.Job;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.Submission;
import io.tissueflow.storage.JobStore;
import io.tissueflow.workflow.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

public abstract class BatchPlanner {
    private static final Logger log = LoggerFactory.getLogger(BatchPlanner.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS");

    protected final long experimentId;
    protected final StepName step;
    protected final ExperimentLayout layout;
    protected final int verbosity;

    protected BatchPlanner(long experimentId, StepName step, ExperimentLayout layout, int verbosity) {
        if (step == null) {
            throw new IllegalArgumentException("Step cannot be null");
        }
        this.experimentId = experimentId;
        this.step = step;
        this.layout = layout;
        this.verbosity = Math.max(0, verbosity);
    }

    /**
     * Creates the run batches (ids 1..N) and, when the step has a fan-in
     * phase, the collect batch. Paths are absolute.
     */
    protected abstract JobDescriptions createBatches(Map<String, Object> args);

    public abstract void runJob(Batch batch);

    public void collectJobOutput(Batch batch) {
        throw new IllegalStateException("Step \"" + step + "\" has no collect phase");
    }

    public final JobDescriptions plan(Map<String, Object> args) {
        JobDescriptions descriptions = createBatches(args == null ? Map.of() : args);
        validateBatchIds(descriptions.run());
        log.info("planned {} run job(s) for step \"{}\"{}", descriptions.run().size(), step,
                descriptions.hasCollect() ? " plus a collect job" : "");
        return descriptions;
    }

    public StepName step() {
        return step;
    }

    public long experimentId() {
        return experimentId;
    }

    public ExperimentLayout layout() {
        return layout;
    }

    public Path stepDir() {
        return layout.stepDir(step.label());
    }

    public Path jobDescriptionsDir() {
        return layout.jobDescriptionsDir(step.label());
    }

    public Path logDir() {
        return layout.logDir(step.label());
    }

    public BatchPaths batchPaths() {
        return new BatchPaths(layout.experimentRoot());
    }

    public JobStore jobStore() {
        return new JobStore(step.label(), jobDescriptionsDir(), batchPaths());
    }

    public void initialize() {
        try {
            Files.createDirectories(stepDir());
            Files.createDirectories(jobDescriptionsDir());
            Files.createDirectories(logDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create directories of step: " + step, e);
        }
        log.debug("initialized step directory {}", stepDir());
    }

    public void teardown() {
        Path dir = stepDir();
        if (!Files.exists(dir)) {
            return;
        }
        deleteRecursively(dir);
        log.info("removed step directory {}", dir);
    }

    /**
     * Clears the job descriptions and logs of an earlier planning pass before
     * the step is planned again. With {@code backup} the log directory is
     * moved to {@code log_backup_<timestamp>} instead of being deleted. Data
     * written by earlier jobs is kept.
     *
     * @return the backup directory, if one was created
     */
    public Optional<Path> resetForPlanning(boolean backup) {
        int removed = jobStore().delete();
        if (removed > 0) {
            log.info("removed {} job description file(s) of step \"{}\"", removed, step);
        }
        Path logs = logDir();
        if (!Files.exists(logs)) {
            return Optional.empty();
        }
        if (!backup) {
            log.info("overwrite output of previous submission in {}", logs);
            deleteRecursively(logs);
            return Optional.empty();
        }
        Path target = logs.resolveSibling(logs.getFileName() + "_backup_" + LocalDateTime.now().format(BACKUP_STAMP));
        try {
            Files.move(logs, target);
        } catch (IOException e) {
            throw new RuntimeException("Failed to back up log directory: " + logs, e);
        }
        log.info("created backup of previous submission: {}", target);
        return Optional.of(target);
    }

    public List<String> buildRunCommand(Batch batch) {
        List<String> command = baseCommand();
        command.add("run");
        command.add("--job");
        command.add(String.valueOf(batch.id()));
        return command;
    }

    public List<String> buildCollectCommand() {
        List<String> command = baseCommand();
        command.add("collect");
        return command;
    }

    public JobCollection createJobs(JobDescriptions descriptions, Submission submission, JobResources runResources) {
        SchedulerSettings defaults = SchedulerSettings.defaults();
        return createJobs(
                descriptions,
                submission,
                runResources,
                new JobResources(defaults.collectWalltimeDuration(), defaults.collectMemoryMb(), null)
        );
    }

    public JobCollection createJobs(
            JobDescriptions descriptions,
            Submission submission,
            JobResources runResources,
            JobResources collectResources
    ) {
        JobResources run = runResources == null ? JobResources.unspecified() : runResources;
        JobResources collect = collectResources == null ? JobResources.unspecified() : collectResources;
        JobCollection jobs = new JobCollection(step.label(), submission);
        log.info("create jobs for \"run\" phase of step \"{}\"", step);
        for (Batch batch : descriptions.run()) {
            jobs.addRunJob(new Job(
                    runJobName(batch.id()),
                    JobPhase.RUN,
                    batch,
                    buildRunCommand(batch),
                    run.walltime(),
                    run.memoryMb(),
                    run.cores(),
                    submission
            ));
        }
        descriptions.collectBatch().ifPresent(batch -> {
            log.info("create job for \"collect\" phase of step \"{}\"", step);
            jobs.setCollectJob(new Job(
                    collectJobName(),
                    JobPhase.COLLECT,
                    batch,
                    buildCollectCommand(),
                    collect.walltime(),
                    collect.memoryMb(),
                    collect.cores(),
                    submission
            ));
        });
        return jobs;
    }

    public String runJobName(int jobId) {
        return String.format("%s_run_%06d", step.label(), jobId);
    }

    public String collectJobName() {
        return step.label() + "_collect";
    }

    /**
     * Run batch ids must be exactly 1..N, each used once, N at most 10^6.
     */
    public static void validateBatchIds(List<Batch> run) {
        if (run.size() > Batch.MAX_RUN_BATCHES) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.INVALID_BATCH_ID,
                    "Too many run batches: " + run.size() + ", max=" + Batch.MAX_RUN_BATCHES
            );
        }
        Set<Integer> seen = new HashSet<>();
        for (Batch batch : run) {
            Integer id = batch.id();
            if (id == null || id < 1 || id > run.size()) {
                throw new JobDescriptionException(
                        JobDescriptionException.Reason.INVALID_BATCH_ID,
                        "Run batch ids must be dense from 1 to " + run.size() + ", found: " + id
                );
            }
            if (!seen.add(id)) {
                throw new JobDescriptionException(
                        JobDescriptionException.Reason.INVALID_BATCH_ID,
                        "Duplicate run batch id: " + id
                );
            }
        }
    }

    public static <T> List<List<T>> partition(List<T> items, int size) {
        int n = Math.max(1, size);
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += n) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + n))));
        }
        return out;
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove directory: " + dir, e);
        }
    }

    private List<String> baseCommand() {
        List<String> command = new ArrayList<>();
        command.add(step.label());
        for (int i = 0; i < verbosity; i++) {
            command.add("-v");
        }
        command.add(String.valueOf(experimentId));
        return command;
    }
}
