package com.baumwelch.server.hmm;

import java.util.Arrays;

/**
 * E-step: combines forward and backward tables with the current model into
 * expected transition and emission counts.
 */
public class SufficientStatisticsEstimator {

    public ExpectedCounts estimate(HmmModel model, ObservationSequence obs, double[][] forward,
            double[][] backward) {
        double logP = ForwardRecursion.logLikelihood(forward);
        if (logP == Double.NEGATIVE_INFINITY || Double.isNaN(logP)) {
            throw new DegenerateStatisticsException(
                    "Observation sequence has zero probability under the current model (log-likelihood " + logP
                            + ")");
        }
        return new ExpectedCounts(
                expectedTransitions(model, obs, forward, backward, logP),
                expectedEmissions(model, obs, forward, backward, logP),
                logP);
    }

    double[][] expectedTransitions(HmmModel model, ObservationSequence obs, double[][] forward,
            double[][] backward, double logP) {
        int n = model.getNumStates();
        int len = obs.length();
        double[][] counts = new double[n][n];

        for (int x = 0; x < n; x++) {
            for (int y = 0; y < n; y++) {
                double logTransition = MathUtil.safeLog(model.transition(x, y));
                double acc = Double.NEGATIVE_INFINITY;
                if (logTransition != Double.NEGATIVE_INFINITY) {
                    for (int t = 0; t < len - 1; t++) {
                        double term = forward[x][t] + backward[y][t + 1] + logTransition
                                + MathUtil.safeLog(model.emission(y, obs.indexAt(t + 1)));
                        acc = MathUtil.logAdd(acc, term);
                    }
                }
                counts[x][y] = Math.exp(acc - logP);
            }
        }
        return counts;
    }

    double[][] expectedEmissions(HmmModel model, ObservationSequence obs, double[][] forward,
            double[][] backward, double logP) {
        int n = model.getNumStates();
        int k = model.getNumSymbols();
        double[][] acc = new double[n][k];
        for (double[] row : acc) {
            Arrays.fill(row, Double.NEGATIVE_INFINITY);
        }

        // one pass over time instead of one pass per symbol
        for (int i = 0; i < obs.length(); i++) {
            int o = obs.indexAt(i);
            for (int x = 0; x < n; x++) {
                acc[x][o] = MathUtil.logAdd(acc[x][o], forward[x][i] + backward[x][i]);
            }
        }

        double[][] counts = new double[n][k];
        for (int x = 0; x < n; x++) {
            for (int o = 0; o < k; o++) {
                counts[x][o] = Math.exp(acc[x][o] - logP);
            }
        }
        return counts;
    }
}
