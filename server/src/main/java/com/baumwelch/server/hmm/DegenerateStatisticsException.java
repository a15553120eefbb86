package com.baumwelch.server.hmm;

/**
 * Expected counts could not be turned into a valid distribution: a row summed
 * to zero under {@link DegenerateRowPolicy#FAIL}, the sequence has zero
 * probability under the current model, or a NaN reached the re-estimated
 * model.
 */
public class DegenerateStatisticsException extends HmmTrainingException {

    private final String matrixName;
    private final int stateIndex;

    public DegenerateStatisticsException(String matrixName, int stateIndex, String message) {
        super(message);
        this.matrixName = matrixName;
        this.stateIndex = stateIndex;
    }

    public DegenerateStatisticsException(String message) {
        this(null, -1, message);
    }

    public String getMatrixName() {
        return matrixName;
    }

    /**
     * @return zero-based state index, or -1 when the failure is not tied to a
     *         single row
     */
    public int getStateIndex() {
        return stateIndex;
    }
}
