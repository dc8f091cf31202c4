package io.tissueflow.runtime;

import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class StatusTableTest {

    @Test
    void unmeasuredMemoryIsNotShownAsZero() {
        List<JobStatus> statuses = List.of(
                new JobStatus("align_run_000001", 1, JobPhase.RUN, JobState.TERMINATED, 0,
                        Duration.ofSeconds(61), Duration.ofSeconds(30), JobStatus.UNKNOWN_MEMORY_MB),
                new JobStatus("align_run_000002", 2, JobPhase.RUN, JobState.TERMINATED, 1,
                        Duration.ofSeconds(5), Duration.ZERO, 512L)
        );

        String table = StatusTable.render("align", JobState.TERMINATED, statuses, 1);
        List<String> lines = table.lines().toList();

        Assertions.assertEquals(4, lines.size());
        Assertions.assertTrue(lines.get(0).contains("(2/2 done, 1 failed)"));
        Assertions.assertTrue(lines.get(2).contains("00:01:01"));
        Assertions.assertTrue(lines.get(2).trim().endsWith(" -"));
        Assertions.assertTrue(lines.get(3).trim().endsWith(" 512"));
        Assertions.assertEquals(1, StatusTable.render("align", JobState.TERMINATED, statuses, 0).lines().count());
    }
}
