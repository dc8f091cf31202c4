package io.tissueflow.runtime;

import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobStatus;

import java.time.Duration;
import java.util.List;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (jobs, statuses, elapsed) -> {
    };

    void onProgress(JobCollection jobs, List<JobStatus> statuses, Duration elapsed);

    default ProgressListener andThen(ProgressListener next) {
        return (jobs, statuses, elapsed) -> {
            onProgress(jobs, statuses, elapsed);
            next.onProgress(jobs, statuses, elapsed);
        };
    }
}
