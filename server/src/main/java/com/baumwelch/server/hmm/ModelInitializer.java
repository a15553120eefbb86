package com.baumwelch.server.hmm;

import java.util.Random;

/**
 * Produces starting models for training.
 */
public class ModelInitializer {

    public static final String UNIFORM = "uniform";
    public static final String RANDOM = "random";

    /**
     * Start 1/N, transitions 0.7/N everywhere plus 0.3 on the diagonal,
     * emissions 1/K.
     */
    public static HmmModel uniform(int numStates, int numSymbols) {
        checkSizes(numStates, numSymbols);
        double[] start = new double[numStates];
        double[][] transition = new double[numStates][numStates];
        double[][] emission = new double[numStates][numSymbols];

        for (int i = 0; i < numStates; i++) {
            start[i] = 1.0 / numStates;
            for (int j = 0; j < numStates; j++) {
                transition[i][j] = 0.7 / numStates + (i == j ? 0.3 : 0.0);
            }
            for (int o = 0; o < numSymbols; o++) {
                emission[i][o] = 1.0 / numSymbols;
            }
        }
        return new HmmModel(start, transition, emission);
    }

    /**
     * Every row (and the start vector) sampled uniformly and normalized.
     */
    public static HmmModel random(int numStates, int numSymbols, Random rng) {
        checkSizes(numStates, numSymbols);
        double[] start = randomRow(numStates, rng);
        double[][] transition = new double[numStates][];
        double[][] emission = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            transition[i] = randomRow(numStates, rng);
            emission[i] = randomRow(numSymbols, rng);
        }
        return new HmmModel(start, transition, emission);
    }

    public static HmmModel create(String strategy, int numStates, int numSymbols, Long seed) {
        String s = strategy == null ? UNIFORM : strategy.trim().toLowerCase();
        switch (s) {
            case UNIFORM:
                return uniform(numStates, numSymbols);
            case RANDOM:
                return random(numStates, numSymbols, seed != null ? new Random(seed) : new Random());
            default:
                throw new InvalidModelInputException("Unknown initialization strategy '" + strategy + "'");
        }
    }

    private static double[] randomRow(int size, Random rng) {
        double[] row = new double[size];
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            // keep every entry strictly positive
            row[i] = rng.nextDouble() + 1e-3;
            sum += row[i];
        }
        for (int i = 0; i < size; i++) {
            row[i] /= sum;
        }
        return row;
    }

    private static void checkSizes(int numStates, int numSymbols) {
        if (numStates < 1 || numSymbols < 1) {
            throw new InvalidModelInputException(
                    "numStates and numSymbols must be >= 1, got " + numStates + " and " + numSymbols);
        }
    }
}
