package com.baumwelch.server.hmm;

import java.util.Arrays;

/**
 * Immutable sequence of observed symbol IDs. IDs are 1-indexed into the
 * emission alphabet; {@link #indexAt(int)} gives the zero-based column into
 * the emission matrix.
 */
public final class ObservationSequence {
    private final int[] symbols;

    private ObservationSequence(int[] symbols) {
        this.symbols = symbols;
    }

    public static ObservationSequence of(int... symbols) {
        if (symbols == null || symbols.length == 0) {
            throw new InvalidModelInputException("Observation sequence must contain at least one symbol");
        }
        for (int t = 0; t < symbols.length; t++) {
            if (symbols[t] < 1) {
                throw new InvalidModelInputException(
                        "Observation symbol at position " + (t + 1) + " must be >= 1, got " + symbols[t]);
            }
        }
        return new ObservationSequence(symbols.clone());
    }

    public int length() {
        return symbols.length;
    }

    /**
     * @param t zero-based time index
     * @return the 1-indexed symbol ID observed at t
     */
    public int symbolAt(int t) {
        return symbols[t];
    }

    /**
     * @param t zero-based time index
     * @return the zero-based emission column observed at t
     */
    public int indexAt(int t) {
        return symbols[t] - 1;
    }

    public int maxSymbol() {
        int max = 0;
        for (int s : symbols) {
            if (s > max)
                max = s;
        }
        return max;
    }

    public int[] toArray() {
        return symbols.clone();
    }

    @Override
    public String toString() {
        if (symbols.length <= 20) {
            return Arrays.toString(symbols);
        }
        return "ObservationSequence[length=" + symbols.length + "]";
    }
}
