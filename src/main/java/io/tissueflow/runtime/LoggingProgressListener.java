package io.tissueflow.runtime;

import io.tissueflow.config.Walltimes;
import io.tissueflow.model.JobCollection;
import io.tissueflow.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

public final class LoggingProgressListener implements ProgressListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final int depth;

    public LoggingProgressListener(int depth) {
        this.depth = Math.max(0, depth);
    }

    @Override
    public void onProgress(JobCollection jobs, List<JobStatus> statuses, Duration elapsed) {
        log.info("duration: {}", Walltimes.format(elapsed));
        log.info("{}", StatusTable.render(jobs.stepName(), jobs.state(), statuses, depth));
    }
}
