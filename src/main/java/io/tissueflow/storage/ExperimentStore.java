package io.tissueflow.storage;

import io.tissueflow.model.Experiment;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface ExperimentStore {
    Path experimentRootPath(long experimentId);

    Submission createSubmissionRecord(long experimentId, String program);

    Experiment createExperiment(String name, Path location);

    Optional<Experiment> findExperiment(long experimentId);

    void deleteExperiment(long experimentId);

    void recordJobStatus(long submissionId, JobStatus status);

    List<JobStatus> jobStatuses(long submissionId);

    Optional<Submission> latestSubmission(long experimentId, String program);
}
