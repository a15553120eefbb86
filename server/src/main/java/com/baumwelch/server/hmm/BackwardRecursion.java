package com.baumwelch.server.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Backward pass: {@code backward[s][t] = log P(obs[t+1..L-1] | state_t = s)},
 * with the last column fixed at log(1) = 0.
 */
public class BackwardRecursion {
    private static final Logger logger = LoggerFactory.getLogger(BackwardRecursion.class);

    public double[][] compute(HmmModel model, ObservationSequence obs) {
        int n = model.getNumStates();
        int len = obs.length();
        double[][] backward = new double[n][len];
        // backward[*][len - 1] is already 0.0

        for (int t = len - 2; t >= 0; t--) {
            int next = obs.indexAt(t + 1);
            for (int s = 0; s < n; s++) {
                double acc = Double.NEGATIVE_INFINITY;
                for (int r = 0; r < n; r++) {
                    double temp = backward[r][t + 1]
                            + MathUtil.safeLog(model.transition(s, r) * model.emission(r, next));
                    acc = MathUtil.logAdd(acc, temp);
                }
                backward[s][t] = acc;
            }
        }

        if (logger.isTraceEnabled()) {
            for (int s = 0; s < n; s++) {
                logger.trace("backward[{}] = {}", s + 1, Arrays.toString(backward[s]));
            }
        }
        return backward;
    }
}
