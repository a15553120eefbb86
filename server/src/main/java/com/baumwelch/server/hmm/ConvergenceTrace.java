package com.baumwelch.server.hmm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-iteration record of a training run: iteration index, divergence
 * between the model that entered the iteration and the one it produced, and
 * the sequence log-likelihood under the entering model.
 */
public class ConvergenceTrace {
    private final List<Integer> iterations = new ArrayList<>();
    private final List<Double> divergences = new ArrayList<>();
    private final List<Double> logLikelihoods = new ArrayList<>();

    void record(int iteration, double divergence, double logLikelihood) {
        iterations.add(iteration);
        divergences.add(divergence);
        logLikelihoods.add(logLikelihood);
    }

    public int size() {
        return iterations.size();
    }

    public List<Integer> getIterations() {
        return Collections.unmodifiableList(iterations);
    }

    public List<Double> getDivergences() {
        return Collections.unmodifiableList(divergences);
    }

    public List<Double> getLogLikelihoods() {
        return Collections.unmodifiableList(logLikelihoods);
    }

    /**
     * @return 2 x size matrix; row 0 holds iteration indices (1-based), row 1
     *         the divergences
     */
    public double[][] toMatrix() {
        double[][] m = new double[2][size()];
        for (int i = 0; i < size(); i++) {
            m[0][i] = iterations.get(i);
            m[1][i] = divergences.get(i);
        }
        return m;
    }

    public static ConvergenceTrace fromMatrix(double[][] matrix, double[] logLikelihoods) {
        ConvergenceTrace trace = new ConvergenceTrace();
        for (int i = 0; i < matrix[0].length; i++) {
            double ll = logLikelihoods != null && i < logLikelihoods.length ? logLikelihoods[i] : Double.NaN;
            trace.record((int) matrix[0][i], matrix[1][i], ll);
        }
        return trace;
    }

    public double[] logLikelihoodArray() {
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = logLikelihoods.get(i);
        }
        return out;
    }
}
