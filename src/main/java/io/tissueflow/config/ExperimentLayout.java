package io.tissueflow.config;

import java.nio.file.Path;

public final class ExperimentLayout {
    private final Path experimentRoot;

    public ExperimentLayout(Path experimentRoot) {
        this.experimentRoot = experimentRoot.toAbsolutePath().normalize();
    }

    public Path experimentRoot() {
        return experimentRoot;
    }

    public Path workflowDir() {
        return experimentRoot.resolve("workflow");
    }

    public Path stepDir(String stepName) {
        return workflowDir().resolve(stepName);
    }

    public Path jobDescriptionsDir(String stepName) {
        return stepDir(stepName).resolve("job_descriptions");
    }

    public Path logDir(String stepName) {
        return stepDir(stepName).resolve("log");
    }

    public Path dataDir(String stepName) {
        return stepDir(stepName).resolve("data");
    }
}
