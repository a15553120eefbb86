package com.baumwelch.server.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Forward pass of the forward-backward algorithm.
 * <p>
 * {@code forward[s][t] = log P(obs[0..t], state_t = s)}. Zero probabilities
 * become negative infinity; there are no error conditions.
 */
public class ForwardRecursion {
    private static final Logger logger = LoggerFactory.getLogger(ForwardRecursion.class);

    private final ForwardMode mode;

    public ForwardRecursion(ForwardMode mode) {
        this.mode = mode;
    }

    public ForwardMode getMode() {
        return mode;
    }

    /**
     * @return table of shape [numStates][sequenceLength] in natural log
     */
    public double[][] compute(HmmModel model, ObservationSequence obs) {
        int n = model.getNumStates();
        int len = obs.length();
        double[][] forward = new double[n][len];

        int o0 = obs.indexAt(0);
        for (int s = 0; s < n; s++) {
            forward[s][0] = MathUtil.safeLog(model.start(s) * model.emission(s, o0));
        }

        for (int t = 1; t < len; t++) {
            int ot = obs.indexAt(t);
            for (int s = 0; s < n; s++) {
                double logEmission = MathUtil.safeLog(model.emission(s, ot));
                if (logEmission == Double.NEGATIVE_INFINITY) {
                    forward[s][t] = Double.NEGATIVE_INFINITY;
                    continue;
                }
                double stateSum = mode == ForwardMode.LOG_SPACE
                        ? logStateSum(model, forward, s, t)
                        : linearStateSum(model, forward, s, t);
                forward[s][t] = stateSum + logEmission;
            }
        }

        if (logger.isTraceEnabled()) {
            for (int s = 0; s < n; s++) {
                logger.trace("forward[{}] = {}", s + 1, Arrays.toString(forward[s]));
            }
        }
        return forward;
    }

    private double logStateSum(HmmModel model, double[][] forward, int s, int t) {
        double acc = Double.NEGATIVE_INFINITY;
        for (int r = 0; r < forward.length; r++) {
            acc = MathUtil.logAdd(acc, forward[r][t - 1] + MathUtil.safeLog(model.transition(r, s)));
        }
        return acc;
    }

    // Shift by the column max so exp() stays in range, sum in linear space,
    // then add the shift back after the log.
    private double linearStateSum(HmmModel model, double[][] forward, int s, int t) {
        double max = Double.NEGATIVE_INFINITY;
        for (int r = 0; r < forward.length; r++) {
            if (forward[r][t - 1] > max)
                max = forward[r][t - 1];
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0.0;
        for (int r = 0; r < forward.length; r++) {
            sum += Math.exp(forward[r][t - 1] - max) * model.transition(r, s);
        }
        return MathUtil.safeLog(sum) + max;
    }

    /**
     * Total sequence log-likelihood: log-sum-exp over the last forward column.
     */
    public static double logLikelihood(double[][] forward) {
        int last = forward[0].length - 1;
        return MathUtil.logSumExp(MathUtil.column(forward, last));
    }
}
