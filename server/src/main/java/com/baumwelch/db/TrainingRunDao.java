package com.baumwelch.db;

import com.baumwelch.server.hmm.ConvergenceTrace;
import com.baumwelch.server.hmm.FitResult;
import com.baumwelch.server.hmm.HmmModel;
import com.baumwelch.util.DoubleArrayCodec;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TrainingRunDao {

    private static final String COLUMNS = "id, num_states, num_symbols, iterations, final_log_likelihood, "
            + "start_blob, transition_blob, emission_blob, trace_blob, log_likelihood_blob, created_ts";

    private final String dbPath;

    public TrainingRunDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public long insert(FitResult result) throws SQLException {
        HmmModel model = result.getModel();
        ConvergenceTrace trace = result.getTrace();
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO training_run (num_states, num_symbols, iterations, final_log_likelihood, " +
                "start_blob, transition_blob, emission_blob, trace_blob, log_likelihood_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = connect()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, model.getNumStates());
                ps.setInt(2, model.getNumSymbols());
                ps.setInt(3, trace.size());
                ps.setDouble(4, result.getFinalLogLikelihood());
                ps.setBytes(5, DoubleArrayCodec.toBytes(model.getStartProb()));
                ps.setBytes(6, DoubleArrayCodec.matrixToBytes(model.getTransitionProb()));
                ps.setBytes(7, DoubleArrayCodec.matrixToBytes(model.getEmissionProb()));
                ps.setBytes(8, DoubleArrayCodec.matrixToBytes(trace.toMatrix()));
                ps.setBytes(9, DoubleArrayCodec.toBytes(trace.logLikelihoodArray()));
                ps.setLong(10, now);
                ps.executeUpdate();
            }
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
                throw new SQLException("Creating training_run failed, no ID obtained.");
            }
        }
    }

    public Optional<TrainingRun> findById(long id) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM training_run WHERE id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<TrainingRun> listRecent(int limit) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM training_run ORDER BY created_ts DESC, id DESC LIMIT ?";
        List<TrainingRun> runs = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(map(rs));
                }
            }
        }
        return runs;
    }

    public boolean delete(long id) throws SQLException {
        String sql = "DELETE FROM training_run WHERE id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    private TrainingRun map(ResultSet rs) throws SQLException {
        int n = rs.getInt("num_states");
        int k = rs.getInt("num_symbols");
        int iterations = rs.getInt("iterations");

        double[] start = DoubleArrayCodec.fromBytes(rs.getBytes("start_blob"));
        double[][] transition = DoubleArrayCodec.matrixFromBytes(rs.getBytes("transition_blob"), n, n);
        double[][] emission = DoubleArrayCodec.matrixFromBytes(rs.getBytes("emission_blob"), n, k);
        double[][] traceMatrix = DoubleArrayCodec.matrixFromBytes(rs.getBytes("trace_blob"), 2, iterations);
        double[] logLikelihoods = DoubleArrayCodec.fromBytes(rs.getBytes("log_likelihood_blob"));

        return new TrainingRun(
                rs.getLong("id"),
                iterations,
                new HmmModel(start, transition, emission),
                ConvergenceTrace.fromMatrix(traceMatrix, logLikelihoods),
                rs.getDouble("final_log_likelihood"),
                rs.getLong("created_ts"));
    }
}
