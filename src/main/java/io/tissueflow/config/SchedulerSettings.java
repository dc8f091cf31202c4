package io.tissueflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.tissueflow.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public record SchedulerSettings(
        long monitoringIntervalSeconds,
        int submitCap,
        String collectWalltime,
        long collectMemoryMb,
        int monitoringDepth
) {
    public static final long DEFAULT_MONITORING_INTERVAL_SECONDS = 5L;
    public static final int DEFAULT_SUBMIT_CAP = 2000;
    public static final String DEFAULT_COLLECT_WALLTIME = "02:00:00";
    public static final long DEFAULT_COLLECT_MEMORY_MB = 4000L;
    public static final int DEFAULT_MONITORING_DEPTH = 1;

    public SchedulerSettings {
        if (monitoringIntervalSeconds < 0) {
            throw new IllegalArgumentException("monitoringIntervalSeconds must not be negative");
        }
        if (submitCap <= 0) {
            throw new IllegalArgumentException("submitCap must be positive");
        }
        if (collectWalltime == null || collectWalltime.isBlank()) {
            collectWalltime = DEFAULT_COLLECT_WALLTIME;
        }
        monitoringDepth = Math.max(0, monitoringDepth);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                DEFAULT_MONITORING_INTERVAL_SECONDS,
                DEFAULT_SUBMIT_CAP,
                DEFAULT_COLLECT_WALLTIME,
                DEFAULT_COLLECT_MEMORY_MB,
                DEFAULT_MONITORING_DEPTH
        );
    }

    public static SchedulerSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        JsonNode node = Jsons.readTree(file);
        SchedulerSettings d = defaults();
        return new SchedulerSettings(
                node.path("monitoringIntervalSeconds").asLong(d.monitoringIntervalSeconds()),
                node.path("submitCap").asInt(d.submitCap()),
                node.path("collectWalltime").asText(d.collectWalltime()),
                node.path("collectMemoryMb").asLong(d.collectMemoryMb()),
                node.path("monitoringDepth").asInt(d.monitoringDepth())
        );
    }

    public Duration monitoringInterval() {
        return Duration.ofSeconds(monitoringIntervalSeconds);
    }

    public Duration collectWalltimeDuration() {
        return Walltimes.parse(collectWalltime);
    }
}
