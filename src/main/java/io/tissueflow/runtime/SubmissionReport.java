package io.tissueflow.runtime;

import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;

import java.util.List;

public record SubmissionReport(long submissionId, JobState state, List<JobStatus> statuses, List<JobStatus> failures) {
    public SubmissionReport {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
