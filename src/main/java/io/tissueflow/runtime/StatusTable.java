package io.tissueflow.runtime;

import io.tissueflow.config.Walltimes;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;

import java.util.List;

public final class StatusTable {
    private static final String ROW = "%-32s %-8s %-10s %5s %10s %10s %8s";

    private StatusTable() {
    }

    public static String render(String title, JobState aggregate, List<JobStatus> statuses, int depth) {
        long done = statuses.stream().filter(s -> s.state().isTerminal()).count();
        long failed = statuses.stream().filter(JobStatus::failed).count();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s: %s (%d/%d done, %d failed)", title, aggregate, done, statuses.size(), failed));
        if (depth <= 0) {
            return sb.toString();
        }
        sb.append(System.lineSeparator())
                .append(String.format(ROW, "job", "phase", "state", "exit", "elapsed", "cpu", "mem_mb"));
        for (JobStatus status : statuses) {
            sb.append(System.lineSeparator()).append(String.format(
                    ROW,
                    status.jobName(),
                    status.phase(),
                    status.state(),
                    status.exitCode() == null ? "-" : status.exitCode().toString(),
                    Walltimes.format(status.elapsedTime()),
                    Walltimes.format(status.cpuTime()),
                    status.maxMemoryMb() < 0 ? "-" : String.valueOf(status.maxMemoryMb())
            ));
        }
        return sb.toString();
    }
}
