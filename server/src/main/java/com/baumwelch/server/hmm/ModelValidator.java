package com.baumwelch.server.hmm;

/**
 * Checks model dimensions, the stochastic invariants and the observation
 * alphabet before any training iteration runs.
 */
public class ModelValidator {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final double tolerance;

    public ModelValidator() {
        this(DEFAULT_TOLERANCE);
    }

    public ModelValidator(double tolerance) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive");
        }
        this.tolerance = tolerance;
    }

    public void validate(HmmModel model, ObservationSequence obs) {
        validate(model);
        int k = model.getNumSymbols();
        for (int t = 0; t < obs.length(); t++) {
            if (obs.symbolAt(t) > k) {
                throw new InvalidModelInputException("Observation symbol " + obs.symbolAt(t) + " at position "
                        + (t + 1) + " is outside alphabet [1," + k + "]");
            }
        }
    }

    public void validate(HmmModel model) {
        double[] start = model.getStartProb();
        double[][] transition = model.getTransitionProb();
        double[][] emission = model.getEmissionProb();
        int n = start.length;

        if (n < 1) {
            throw new InvalidModelInputException("Model must have at least one hidden state");
        }
        if (transition.length != n) {
            throw new InvalidModelInputException(
                    "Transition matrix has " + transition.length + " rows, expected " + n);
        }
        for (int i = 0; i < n; i++) {
            if (transition[i].length != n) {
                throw new InvalidModelInputException("Transition matrix must be " + n + "x" + n);
            }
        }
        if (emission.length != n) {
            throw new InvalidModelInputException("Emission matrix has " + emission.length + " rows, expected " + n);
        }
        int k = emission[0].length;
        if (k < 1) {
            throw new InvalidModelInputException("Emission matrix must have at least one symbol column");
        }
        for (int i = 0; i < n; i++) {
            if (emission[i].length != k) {
                throw new InvalidModelInputException("Emission matrix rows must all have " + k + " columns");
            }
        }

        checkDistribution("startProb", -1, start);
        for (int i = 0; i < n; i++) {
            checkDistribution("transitionProb", i, transition[i]);
            checkDistribution("emissionProb", i, emission[i]);
        }
    }

    private void checkDistribution(String name, int row, double[] p) {
        String where = row < 0 ? name : name + " row " + (row + 1);
        for (int j = 0; j < p.length; j++) {
            double v = p[j];
            if (!Double.isFinite(v) || v < -tolerance || v > 1.0 + tolerance) {
                throw new InvalidModelInputException(where + " has entry " + v + " outside [0,1]");
            }
        }
        double sum = MathUtil.rowSum(p);
        if (Math.abs(sum - 1.0) > tolerance) {
            throw new InvalidModelInputException(where + " sums to " + sum + ", expected 1");
        }
    }
}
