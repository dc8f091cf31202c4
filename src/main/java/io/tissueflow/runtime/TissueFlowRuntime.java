package io.tissueflow.runtime;

import io.tissueflow.batch.BatchPlanner;
import io.tissueflow.batch.FileBatchPlanner;
import io.tissueflow.batch.JobResources;
import io.tissueflow.config.ExperimentLayout;
import io.tissueflow.config.SchedulerSettings;
import io.tissueflow.config.TissueFlowConfig;
import io.tissueflow.fusion.DatasetFusion;
import io.tissueflow.model.Batch;
import io.tissueflow.model.Experiment;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;
import io.tissueflow.storage.Database;
import io.tissueflow.storage.ExperimentStore;
import io.tissueflow.storage.JobStore;
import io.tissueflow.storage.SqliteExperimentStore;
import io.tissueflow.workflow.StepName;
import io.tissueflow.workflow.WorkflowDescription;
import io.tissueflow.workflow.WorkflowDescriptionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TissueFlowRuntime {
    private static final Logger log = LoggerFactory.getLogger(TissueFlowRuntime.class);

    private final TissueFlowConfig config;
    private final Database database;
    private final ExperimentStore store;
    private final SchedulerSettings settings;

    public TissueFlowRuntime(TissueFlowConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.store = new SqliteExperimentStore(database);
        this.settings = config.loadSettings();
    }

    public void init() {
        database.init();
    }

    public TissueFlowConfig config() {
        return config;
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public ExperimentStore store() {
        return store;
    }

    public Experiment createExperiment(String name, Path location) {
        return store.createExperiment(name, location == null ? config.rootDir().resolve("experiments") : location);
    }

    public void deleteExperiment(long experimentId) {
        store.deleteExperiment(experimentId);
    }

    public WorkflowDescription loadWorkflow(Path file) {
        try {
            return WorkflowDescriptionLoader.load(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read workflow description: " + file, e);
        }
    }

    public BatchPlanner planner(long experimentId, StepName step, int verbosity) {
        ExperimentLayout layout = new ExperimentLayout(store.experimentRootPath(experimentId));
        return new FileBatchPlanner(experimentId, step, layout, verbosity, new DatasetFusion());
    }

    public JobDescriptions initStep(long experimentId, StepName step, Map<String, Object> args) {
        return initStep(experimentId, step, args, false);
    }

    public JobDescriptions initStep(long experimentId, StepName step, Map<String, Object> args, boolean backup) {
        BatchPlanner planner = planner(experimentId, step, 0);
        planner.resetForPlanning(backup);
        planner.initialize();
        JobDescriptions descriptions = planner.plan(args);
        planner.jobStore().write(descriptions);
        return descriptions;
    }

    public JobDescriptions describeStep(long experimentId, StepName step) {
        return planner(experimentId, step, 0).jobStore().readAll();
    }

    public Optional<Submission> latestSubmission(long experimentId, StepName step) {
        return store.latestSubmission(experimentId, step.label());
    }

    public List<JobStatus> jobStatuses(long submissionId) {
        return store.jobStatuses(submissionId);
    }

    public SubmissionReport submit(
            long experimentId,
            StepName step,
            int verbosity,
            JobResources runResources,
            List<String> launcher
    ) throws InterruptedException {
        BatchPlanner planner = planner(experimentId, step, verbosity);
        JobDescriptions descriptions = planner.jobStore().readAll();
        Submission submission = store.createSubmissionRecord(experimentId, step.label());
        JobResources collectResources = new JobResources(
                settings.collectWalltimeDuration(),
                settings.collectMemoryMb(),
                null
        );
        JobCollection jobs = planner.createJobs(descriptions, submission, runResources, collectResources);
        log.info("submit {} job(s) of step \"{}\" as submission {}", jobs.all().size(), step, submission.id());
        ProgressListener listener = new LoggingProgressListener(settings.monitoringDepth())
                .andThen((collection, statuses, elapsed) ->
                        statuses.forEach(status -> store.recordJobStatus(submission.id(), status)));
        try (LocalProcessEngine engine = new LocalProcessEngine(
                launcher,
                planner.logDir(),
                planner.layout().experimentRoot()
        )) {
            JobScheduler scheduler = new JobScheduler(engine, settings.monitoringInterval(), listener);
            return scheduler.submit(jobs, settings.submitCap());
        }
    }

    public void runJob(long experimentId, StepName step, int jobId, int verbosity) {
        BatchPlanner planner = planner(experimentId, step, verbosity);
        Batch batch = planner.jobStore().readRun(jobId);
        log.info("run job {} of step \"{}\"", jobId, step);
        planner.runJob(batch);
    }

    public void collect(long experimentId, StepName step, int verbosity) {
        BatchPlanner planner = planner(experimentId, step, verbosity);
        Batch batch = planner.jobStore().readCollect();
        log.info("collect output of step \"{}\"", step);
        planner.collectJobOutput(batch);
    }

    public Optional<JobLogs> logs(long experimentId, StepName step, Integer jobId) {
        BatchPlanner planner = planner(experimentId, step, 0);
        String jobName = jobId == null ? planner.collectJobName() : planner.runJobName(jobId);
        return JobLogs.latest(planner.logDir(), jobName);
    }

    public void teardown(long experimentId, StepName step) {
        planner(experimentId, step, 0).teardown();
    }

    public List<String> merge(Path oldFile, Path newFile) {
        return new DatasetFusion().merge(oldFile, newFile);
    }
}
