package com.baumwelch.server.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * M-step: row-normalizes expected counts into a new model and measures how
 * far it moved from the previous one.
 */
public class ModelUpdater {
    private static final Logger logger = LoggerFactory.getLogger(ModelUpdater.class);

    private final DegenerateRowPolicy degenerateRowPolicy;

    public ModelUpdater(DegenerateRowPolicy degenerateRowPolicy) {
        this.degenerateRowPolicy = degenerateRowPolicy;
    }

    /**
     * Builds the re-estimated model. The start vector is carried over
     * unchanged.
     */
    public HmmModel update(HmmModel previous, ExpectedCounts counts) {
        double[][] newTransition = normalizeRows("transitionProb", counts.transitionsView());
        double[][] newEmission = normalizeRows("emissionProb", counts.emissionsView());

        if (MathUtil.containsNaN(newTransition) || MathUtil.containsNaN(newEmission)) {
            throw new DegenerateStatisticsException("Re-estimated model contains NaN");
        }
        return previous.withTransitionAndEmission(newTransition, newEmission);
    }

    /**
     * L2 distance between the emission matrices plus L2 distance between the
     * transition matrices.
     */
    public static double divergence(HmmModel previous, HmmModel next) {
        return MathUtil.frobeniusDistance(previous.getEmissionProb(), next.getEmissionProb())
                + MathUtil.frobeniusDistance(previous.getTransitionProb(), next.getTransitionProb());
    }

    double[][] normalizeRows(String matrixName, double[][] counts) {
        double[][] out = new double[counts.length][];
        for (int i = 0; i < counts.length; i++) {
            double[] row = counts[i];
            double sum = MathUtil.rowSum(row);
            out[i] = new double[row.length];

            if (sum > 0.0 && Double.isFinite(sum)) {
                for (int j = 0; j < row.length; j++) {
                    out[i][j] = row[j] / sum;
                }
                continue;
            }

            if (degenerateRowPolicy == DegenerateRowPolicy.FAIL) {
                throw new DegenerateStatisticsException(matrixName, i,
                        "Expected counts for " + matrixName + " row " + (i + 1) + " sum to " + sum);
            }
            logger.warn("Expected counts for {} row {} sum to {}; redistributing uniformly", matrixName, i + 1,
                    sum);
            Arrays.fill(out[i], 1.0 / row.length);
        }
        return out;
    }
}
