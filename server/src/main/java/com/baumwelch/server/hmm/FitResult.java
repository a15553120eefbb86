package com.baumwelch.server.hmm;

public class FitResult {
    private final HmmModel model;
    private final ConvergenceTrace trace;
    private final double finalLogLikelihood;

    public FitResult(HmmModel model, ConvergenceTrace trace, double finalLogLikelihood) {
        this.model = model;
        this.trace = trace;
        this.finalLogLikelihood = finalLogLikelihood;
    }

    public HmmModel getModel() {
        return model;
    }

    public double[][] getTransitionProb() {
        return model.getTransitionProb();
    }

    public double[][] getEmissionProb() {
        return model.getEmissionProb();
    }

    public ConvergenceTrace getTrace() {
        return trace;
    }

    /**
     * Sequence log-likelihood under the final, re-estimated model.
     */
    public double getFinalLogLikelihood() {
        return finalLogLikelihood;
    }
}
