package com.baumwelch.server.hmm;

/**
 * Expected transition (N x N) and emission (N x K) counts for one E-step,
 * not yet normalized. Carries the sequence log-likelihood they were
 * normalized against.
 */
public final class ExpectedCounts {
    private final double[][] transitions;
    private final double[][] emissions;
    private final double logLikelihood;

    ExpectedCounts(double[][] transitions, double[][] emissions, double logLikelihood) {
        this.transitions = transitions;
        this.emissions = emissions;
        this.logLikelihood = logLikelihood;
    }

    public double[][] getTransitions() {
        return MathUtil.copy(transitions);
    }

    public double[][] getEmissions() {
        return MathUtil.copy(emissions);
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    double[][] transitionsView() {
        return transitions;
    }

    double[][] emissionsView() {
        return emissions;
    }
}
