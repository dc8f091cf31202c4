package io.tissueflow.storage;

import io.tissueflow.model.Experiment;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import io.tissueflow.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public final class SqliteExperimentStore implements ExperimentStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteExperimentStore.class);

    private final Database database;

    public SqliteExperimentStore(Database database) {
        this.database = database;
    }

    @Override
    public Path experimentRootPath(long experimentId) {
        return findExperiment(experimentId)
                .map(Experiment::root)
                .orElseThrow(() -> new IllegalArgumentException("Experiment not found: " + experimentId));
    }

    @Override
    public Experiment createExperiment(String name, Path location) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Experiment name cannot be empty");
        }
        Path root = location.resolve(name).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create experiment directory: " + root, e);
        }
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO experiments(name,root_path,created_at_ms) VALUES (?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, root.toString());
            ps.setLong(3, now);
            ps.executeUpdate();
            long id = lastInsertId(c);
            log.info("created experiment {} \"{}\" at {}", id, name, root);
            return new Experiment(id, name, root, Instant.ofEpochMilli(now));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create experiment", e);
        }
    }

    @Override
    public Optional<Experiment> findExperiment(long experimentId) {
        String sql = "SELECT id,name,root_path,created_at_ms FROM experiments WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, experimentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Experiment(
                        rs.getLong("id"), rs.getString("name"), Paths.get(rs.getString("root_path")),
                        Instant.ofEpochMilli(rs.getLong("created_at_ms"))
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read experiment", e);
        }
    }

    @Override
    public void deleteExperiment(long experimentId) {
        Path root = experimentRootPath(experimentId);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM experiments WHERE id=?")) {
            ps.setLong(1, experimentId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete experiment", e);
        }
        if (Files.exists(root)) {
            try (Stream<Path> walk = Files.walk(root)) {
                for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to remove experiment directory: " + root, e);
            }
        }
        log.info("deleted experiment {} at {}", experimentId, root);
    }

    @Override
    public Submission createSubmissionRecord(long experimentId, String program) {
        experimentRootPath(experimentId);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO submissions(experiment_id,program,created_at_ms) VALUES (?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, experimentId);
            ps.setString(2, program);
            ps.setLong(3, now);
            ps.executeUpdate();
            return new Submission(lastInsertId(c), experimentId, program, Instant.ofEpochMilli(now));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create submission", e);
        }
    }

    @Override
    public Optional<Submission> latestSubmission(long experimentId, String program) {
        String sql = """
                SELECT id,experiment_id,program,created_at_ms FROM submissions
                WHERE experiment_id=? AND program=? ORDER BY id DESC LIMIT 1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, experimentId);
            ps.setString(2, program);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Submission(
                        rs.getLong("id"), rs.getLong("experiment_id"), rs.getString("program"),
                        Instant.ofEpochMilli(rs.getLong("created_at_ms"))
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read submission", e);
        }
    }

    @Override
    public void recordJobStatus(long submissionId, JobStatus status) {
        String sql = """
                INSERT INTO tasks(submission_id,job_name,job_id,phase,state,exit_code,elapsed_ms,cpu_ms,max_memory_mb,updated_at_ms)
                VALUES (?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(submission_id,job_name) DO UPDATE SET
                    state=excluded.state,exit_code=excluded.exit_code,elapsed_ms=excluded.elapsed_ms,
                    cpu_ms=excluded.cpu_ms,max_memory_mb=excluded.max_memory_mb,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, submissionId);
            ps.setString(2, status.jobName());
            if (status.jobId() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setInt(3, status.jobId());
            }
            ps.setString(4, status.phase().name());
            ps.setString(5, status.state().name());
            if (status.exitCode() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setInt(6, status.exitCode());
            }
            ps.setLong(7, status.elapsedTime().toMillis());
            ps.setLong(8, status.cpuTime().toMillis());
            ps.setLong(9, status.maxMemoryMb());
            ps.setLong(10, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record job status", e);
        }
    }

    @Override
    public List<JobStatus> jobStatuses(long submissionId) {
        String sql = """
                SELECT job_name,job_id,phase,state,exit_code,elapsed_ms,cpu_ms,max_memory_mb
                FROM tasks WHERE submission_id=? ORDER BY phase DESC, job_id, job_name
                """;
        List<JobStatus> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, submissionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int jobId = rs.getInt("job_id");
                    Integer boxedJobId = rs.wasNull() ? null : jobId;
                    int exitCode = rs.getInt("exit_code");
                    Integer boxedExitCode = rs.wasNull() ? null : exitCode;
                    out.add(new JobStatus(
                            rs.getString("job_name"),
                            boxedJobId,
                            JobPhase.valueOf(rs.getString("phase")),
                            JobState.valueOf(rs.getString("state")),
                            boxedExitCode,
                            Duration.ofMillis(rs.getLong("elapsed_ms")),
                            Duration.ofMillis(rs.getLong("cpu_ms")),
                            rs.getLong("max_memory_mb")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read job statuses", e);
        }
        return out;
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("No row id returned");
            }
            return rs.getLong(1);
        }
    }
}
