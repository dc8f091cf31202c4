package io.tissueflow.storage;

import io.tissueflow.config.TissueFlowConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final TissueFlowConfig config;
    private final String jdbcUrl;

    public Database(TissueFlowConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS experiments (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL UNIQUE,
                        root_path TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS submissions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        experiment_id INTEGER NOT NULL,
                        program TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(experiment_id) REFERENCES experiments(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        submission_id INTEGER NOT NULL,
                        job_name TEXT NOT NULL,
                        job_id INTEGER,
                        phase TEXT NOT NULL,
                        state TEXT NOT NULL,
                        exit_code INTEGER,
                        elapsed_ms INTEGER NOT NULL DEFAULT 0,
                        cpu_ms INTEGER NOT NULL DEFAULT 0,
                        max_memory_mb INTEGER NOT NULL DEFAULT 0,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(submission_id, job_name),
                        FOREIGN KEY(submission_id) REFERENCES submissions(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_submissions_experiment_program ON submissions(experiment_id, program)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }
}
