package com.baumwelch.server.hmm;

/**
 * Base type for every error raised while validating input or running
 * Baum-Welch training.
 */
public class HmmTrainingException extends RuntimeException {

    public HmmTrainingException(String message) {
        super(message);
    }

    public HmmTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
