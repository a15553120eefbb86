package com.baumwelch.server.hmm;

/**
 * Start, transition or emission probabilities are not stochastic, dimensions
 * disagree, or the observation sequence refers to symbols outside the
 * alphabet.
 */
public class InvalidModelInputException extends HmmTrainingException {

    public InvalidModelInputException(String message) {
        super(message);
    }
}
