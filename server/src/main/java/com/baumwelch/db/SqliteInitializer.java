package com.baumwelch.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // Enable WAL mode
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS training_run (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "num_states INTEGER NOT NULL, " +
                        "num_symbols INTEGER NOT NULL, " +
                        "iterations INTEGER NOT NULL, " +
                        "final_log_likelihood REAL, " +
                        "start_blob BLOB NOT NULL, " +
                        "transition_blob BLOB NOT NULL, " +
                        "emission_blob BLOB NOT NULL, " +
                        "trace_blob BLOB NOT NULL, " +
                        "log_likelihood_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_training_run_created " +
                        "ON training_run (created_ts);");
            }
        }
    }
}
