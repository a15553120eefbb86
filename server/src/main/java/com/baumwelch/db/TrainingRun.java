package com.baumwelch.db;

import com.baumwelch.server.hmm.ConvergenceTrace;
import com.baumwelch.server.hmm.HmmModel;

/**
 * A persisted training result: the fitted model and its convergence trace.
 */
public class TrainingRun {
    private final long id;
    private final int iterations;
    private final HmmModel model;
    private final ConvergenceTrace trace;
    private final double finalLogLikelihood;
    private final long createdTs;

    public TrainingRun(long id, int iterations, HmmModel model, ConvergenceTrace trace,
            double finalLogLikelihood, long createdTs) {
        this.id = id;
        this.iterations = iterations;
        this.model = model;
        this.trace = trace;
        this.finalLogLikelihood = finalLogLikelihood;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public int getIterations() {
        return iterations;
    }

    public HmmModel getModel() {
        return model;
    }

    public ConvergenceTrace getTrace() {
        return trace;
    }

    public double getFinalLogLikelihood() {
        return finalLogLikelihood;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "TrainingRun{id=" + id + ", states=" + model.getNumStates() + ", symbols="
                + model.getNumSymbols() + ", iterations=" + iterations + "}";
    }
}
