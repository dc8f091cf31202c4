package io.tissueflow.cli;

import io.tissueflow.Main;
import io.tissueflow.batch.JobDescriptionException;
import io.tissueflow.batch.JobResources;
import io.tissueflow.config.TissueFlowConfig;
import io.tissueflow.config.Walltimes;
import io.tissueflow.fusion.FusionException;
import io.tissueflow.model.Experiment;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.model.Submission;
import io.tissueflow.runtime.JobLogs;
import io.tissueflow.runtime.SubmissionReport;
import io.tissueflow.runtime.TissueFlowRuntime;
import io.tissueflow.util.Jsons;
import io.tissueflow.workflow.StepName;
import io.tissueflow.workflow.WorkflowDescription;
import io.tissueflow.workflow.WorkflowDescriptionException;
import io.tissueflow.workflow.WorkflowStageDescription;
import io.tissueflow.workflow.WorkflowStepDescription;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "tissueflow",
        mixinStandardHelpOptions = true,
        description = "Workflow, batch submission and data fusion CLI",
        subcommands = {
                TissueFlowCommand.ExperimentCreateCommand.class,
                TissueFlowCommand.ExperimentDeleteCommand.class,
                TissueFlowCommand.ValidateWorkflowCommand.class,
                TissueFlowCommand.InitCommand.class,
                TissueFlowCommand.InfoCommand.class,
                TissueFlowCommand.SubmitCommand.class,
                TissueFlowCommand.CollectCommand.class,
                TissueFlowCommand.LogCommand.class,
                TissueFlowCommand.MergeCommand.class,
                TissueFlowCommand.TeardownCommand.class,
                TissueFlowCommand.StepCommand.class
        }
)
public final class TissueFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    public static CommandLine commandLine() {
        return new CommandLine(new TissueFlowCommand())
                .setExecutionExceptionHandler(new JsonErrorHandler());
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: experiment-create | experiment-delete | validate-workflow | init | info | submit | collect | log | merge | teardown");
    }

    TissueFlowRuntime runtime() {
        TissueFlowRuntime runtime = new TissueFlowRuntime(TissueFlowConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    List<String> launcher() {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(Main.class.getName());
        command.add("--root");
        command.add(TissueFlowConfig.fromRoot(root).rootDir().toString());
        command.add("step");
        return command;
    }

    @Command(name = "experiment-create", description = "Register an experiment and create its directory")
    static final class ExperimentCreateCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Option(names = {"--name"}, required = true, description = "Experiment name")
        String name;

        @Option(names = {"--location"}, description = "Parent directory of the experiment (default: <root>/experiments)")
        String location;

        @Override
        public Integer call() {
            Experiment experiment = parent.runtime().createExperiment(name, location == null ? null : Path.of(location));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", experiment.id());
            out.put("name", experiment.name());
            out.put("root", experiment.root().toString());
            out.put("createdAt", experiment.createdAt());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "experiment-delete", description = "Delete an experiment and its directory")
    static final class ExperimentDeleteCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Override
        public Integer call() {
            parent.runtime().deleteExperiment(experimentId);
            System.out.println(Jsons.toJson(Map.of("deleted", experimentId)));
            return 0;
        }
    }

    @Command(name = "validate-workflow", description = "Check a workflow description file against the stage and step dependencies")
    static final class ValidateWorkflowCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Option(names = {"--file"}, required = true, description = "Workflow description JSON file")
        String file;

        @Override
        public Integer call() {
            WorkflowDescription workflow = parent.runtime().loadWorkflow(Path.of(file));
            List<Map<String, Object>> stages = new ArrayList<>();
            for (WorkflowStageDescription stage : workflow.stages()) {
                List<String> steps = new ArrayList<>();
                for (WorkflowStepDescription step : stage.steps()) {
                    steps.add(step.name().label());
                }
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", stage.name().label());
                entry.put("steps", steps);
                stages.add(entry);
            }
            System.out.println(Jsons.toJson(Map.of("valid", true, "stages", stages)));
            return 0;
        }
    }

    @Command(name = "init", description = "Plan a step and write its job descriptions")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Option(names = {"--workflow"}, description = "Workflow description providing the step arguments")
        String workflow;

        @Option(names = {"--arg"}, description = "Step argument key=value, overrides the workflow description")
        Map<String, String> args = new LinkedHashMap<>();

        @Option(names = {"--backup"}, description = "Keep the logs of the previous submission in a backup directory")
        boolean backup;

        @Override
        public Integer call() {
            TissueFlowRuntime runtime = parent.runtime();
            StepName stepName = StepName.fromString(step);
            Map<String, Object> merged = new LinkedHashMap<>();
            if (workflow != null) {
                runtime.loadWorkflow(Path.of(workflow)).steps().stream()
                        .filter(s -> s.name() == stepName)
                        .findFirst()
                        .ifPresent(s -> merged.putAll(s.args()));
            }
            merged.putAll(args);
            JobDescriptions descriptions = runtime.initStep(experimentId, stepName, merged, backup);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("step", stepName.label());
            out.put("runJobs", descriptions.run().size());
            out.put("collectJob", descriptions.hasCollect());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "info", description = "Show the planned jobs of a step and the status of its last submission")
    static final class InfoCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Override
        public Integer call() {
            TissueFlowRuntime runtime = parent.runtime();
            StepName stepName = StepName.fromString(step);
            JobDescriptions descriptions = runtime.describeStep(experimentId, stepName);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("step", stepName.label());
            out.put("runJobs", descriptions.run().size());
            out.put("collectJob", descriptions.hasCollect());
            out.put("inputFiles", descriptions.inputFiles().size());
            out.put("outputFiles", descriptions.outputFiles().size());
            Optional<Submission> submission = runtime.latestSubmission(experimentId, stepName);
            submission.ifPresent(s -> {
                out.put("submission", s.id());
                out.put("jobs", runtime.jobStatuses(s.id()));
            });
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit the planned jobs of a step and monitor them until done")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Option(names = {"--walltime"}, description = "Wall time of each run job, HH:MM:SS")
        String walltime;

        @Option(names = {"--memory"}, description = "Memory of each run job in MB")
        Long memory;

        @Option(names = {"--cores"}, description = "Cores of each run job")
        Integer cores;

        @Option(names = {"-v", "--verbose"}, description = "Verbosity passed on to the jobs")
        boolean[] verbose = new boolean[0];

        @Override
        public Integer call() throws Exception {
            JobResources resources = new JobResources(
                    walltime == null ? null : Walltimes.parse(walltime),
                    memory,
                    cores
            );
            SubmissionReport report = parent.runtime().submit(
                    experimentId,
                    StepName.fromString(step),
                    verbose.length,
                    resources,
                    parent.launcher()
            );
            System.out.println(Jsons.toJson(report));
            return report.hasFailures() ? 1 : 0;
        }
    }

    @Command(name = "collect", description = "Run the collect phase of a step in this process")
    static final class CollectCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Override
        public Integer call() {
            parent.runtime().collect(experimentId, StepName.fromString(step), 0);
            System.out.println(Jsons.toJson(Map.of("collected", step)));
            return 0;
        }
    }

    @Command(name = "log", description = "Print the output of the last execution of a job")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Option(names = {"--job"}, description = "Run job id; omit for the collect job")
        Integer job;

        @Override
        public Integer call() {
            Optional<JobLogs> logs = parent.runtime().logs(experimentId, StepName.fromString(step), job);
            if (logs.isEmpty()) {
                System.out.println("{\"error\":\"log not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(logs.get()));
            return 0;
        }
    }

    @Command(name = "merge", description = "Copy datasets of an older data file that a newer one lacks")
    static final class MergeCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Option(names = {"--old"}, required = true, description = "Older data file")
        String oldFile;

        @Option(names = {"--new"}, required = true, description = "Newer data file, updated in place")
        String newFile;

        @Override
        public Integer call() {
            List<String> copied = parent.runtime().merge(Path.of(oldFile), Path.of(newFile));
            System.out.println(Jsons.toJson(Map.of("copied", copied)));
            return 0;
        }
    }

    @Command(name = "teardown", description = "Remove the directory of a step")
    static final class TeardownCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Experiment id")
        long experimentId;

        @Parameters(index = "1", description = "Step name")
        String step;

        @Override
        public Integer call() {
            parent.runtime().teardown(experimentId, StepName.fromString(step));
            System.out.println(Jsons.toJson(Map.of("removed", step)));
            return 0;
        }
    }

    @Command(name = "step", hidden = true, description = "Execute one job of a step")
    static final class StepCommand implements Callable<Integer> {
        @ParentCommand
        TissueFlowCommand parent;

        @Parameters(index = "0", description = "Step name")
        String step;

        @Parameters(index = "1", description = "Experiment id")
        long experimentId;

        @Parameters(index = "2", description = "Phase: run|collect")
        String phase;

        @Option(names = {"--job"}, description = "Run job id")
        Integer job;

        @Option(names = {"-v", "--verbose"}, description = "Verbosity")
        boolean[] verbose = new boolean[0];

        @Override
        public Integer call() {
            TissueFlowRuntime runtime = parent.runtime();
            StepName stepName = StepName.fromString(step);
            switch (phase) {
                case "run" -> {
                    if (job == null) {
                        throw new IllegalArgumentException("Option \"--job\" is required for phase \"run\"");
                    }
                    runtime.runJob(experimentId, stepName, job, verbose.length);
                }
                case "collect" -> runtime.collect(experimentId, stepName, verbose.length);
                default -> throw new IllegalArgumentException("Unknown phase: " + phase);
            }
            return 0;
        }
    }

    static final class JsonErrorHandler implements CommandLine.IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("error", ex.getClass().getSimpleName());
            String reason = reasonOf(ex);
            if (reason != null) {
                out.put("reason", reason);
            }
            out.put("message", ex.getMessage() == null ? "" : ex.getMessage());
            commandLine.getErr().println(Jsons.toJson(out));
            return 2;
        }

        private static String reasonOf(Exception ex) {
            if (ex instanceof WorkflowDescriptionException) {
                return ((WorkflowDescriptionException) ex).reason().name();
            }
            if (ex instanceof JobDescriptionException) {
                return ((JobDescriptionException) ex).reason().name();
            }
            if (ex instanceof FusionException) {
                return ((FusionException) ex).reason().name();
            }
            return null;
        }
    }
}
