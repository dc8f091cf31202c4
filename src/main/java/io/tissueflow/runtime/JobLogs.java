package io.tissueflow.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public record JobLogs(String stdout, String stderr) {

    public static Optional<JobLogs> latest(Path logDir, String jobName) {
        Optional<Path> out = latestFile(logDir, jobName + "_*.out");
        Optional<Path> err = latestFile(logDir, jobName + "_*.err");
        if (out.isEmpty() && err.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new JobLogs(out.map(JobLogs::read).orElse(""), err.map(JobLogs::read).orElse("")));
    }

    private static Optional<Path> latestFile(Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        Path latest = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path path : stream) {
                if (latest == null || path.getFileName().toString().compareTo(latest.getFileName().toString()) > 0) {
                    latest = path;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list log files in " + dir, e);
        }
        return Optional.ofNullable(latest);
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read log file: " + file, e);
        }
    }
}
