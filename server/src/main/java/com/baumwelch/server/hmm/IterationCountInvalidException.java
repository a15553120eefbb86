package com.baumwelch.server.hmm;

public class IterationCountInvalidException extends HmmTrainingException {

    private final int iterations;

    public IterationCountInvalidException(int iterations) {
        super("Iteration count must be >= 1, got " + iterations);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
