package com.baumwelch.server.hmm;

/**
 * Immutable discrete HMM: start vector (N), row-stochastic transition matrix
 * (N x N) and row-stochastic emission matrix (N x K).
 * <p>
 * Arrays are copied on the way in and on the way out; training replaces the
 * model rather than mutating it.
 */
public final class HmmModel {
    private final double[] startProb;
    private final double[][] transitionProb;
    private final double[][] emissionProb;

    public HmmModel(double[] startProb, double[][] transitionProb, double[][] emissionProb) {
        if (startProb == null || transitionProb == null || emissionProb == null) {
            throw new InvalidModelInputException("Start, transition and emission probabilities are required");
        }
        this.startProb = startProb.clone();
        this.transitionProb = copyRows("transitionProb", transitionProb);
        this.emissionProb = copyRows("emissionProb", emissionProb);
    }

    private static double[][] copyRows(String name, double[][] m) {
        for (int i = 0; i < m.length; i++) {
            if (m[i] == null) {
                throw new InvalidModelInputException(name + " row " + (i + 1) + " is missing");
            }
        }
        return MathUtil.copy(m);
    }

    public int getNumStates() {
        return startProb.length;
    }

    public int getNumSymbols() {
        return emissionProb.length == 0 ? 0 : emissionProb[0].length;
    }

    public double[] getStartProb() {
        return startProb.clone();
    }

    public double[][] getTransitionProb() {
        return MathUtil.copy(transitionProb);
    }

    public double[][] getEmissionProb() {
        return MathUtil.copy(emissionProb);
    }

    public double start(int state) {
        return startProb[state];
    }

    public double transition(int from, int to) {
        return transitionProb[from][to];
    }

    public double emission(int state, int symbolIndex) {
        return emissionProb[state][symbolIndex];
    }

    /**
     * Returns a model with the same start vector and the given transition and
     * emission matrices.
     */
    public HmmModel withTransitionAndEmission(double[][] newTransition, double[][] newEmission) {
        return new HmmModel(startProb, newTransition, newEmission);
    }
}
