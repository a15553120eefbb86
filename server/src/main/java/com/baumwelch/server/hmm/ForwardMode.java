package com.baumwelch.server.hmm;

/**
 * How the forward recursion sums over source states at each time step.
 * {@link #LOG_SPACE} is the default in {@code hmm_config.json} and
 * {@link TrainerConfig.TrainingConfig}.
 */
public enum ForwardMode {
    /**
     * Sum in linear space after shifting the previous column by its max. Fine
     * for small-to-moderate state counts.
     */
    LINEAR_STATE_SUM,
    /** Log-sum-exp over source states; stable for any state count. */
    LOG_SPACE
}
