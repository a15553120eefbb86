package com.baumwelch.server.hmm;

/**
 * What to do when a row of expected counts sums to zero during normalization.
 */
public enum DegenerateRowPolicy {
    /** Log a warning and replace the row with a uniform distribution. */
    UNIFORM,
    /** Throw {@link DegenerateStatisticsException}. */
    FAIL
}
