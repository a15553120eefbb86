package com.baumwelch.server.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Baum-Welch (EM) training of a discrete HMM on a single observation
 * sequence.
 * <p>
 * Runs exactly the requested number of iterations; there is no
 * convergence-threshold exit. The start vector is never re-estimated. Each
 * call works on its own tables, so one instance can serve concurrent callers.
 */
public class BaumWelchTrainer {
    private static final Logger logger = LoggerFactory.getLogger(BaumWelchTrainer.class);

    private final ForwardRecursion forwardRecursion;
    private final BackwardRecursion backwardRecursion = new BackwardRecursion();
    private final SufficientStatisticsEstimator estimator = new SufficientStatisticsEstimator();
    private final ModelUpdater updater;
    private final ModelValidator validator;

    public BaumWelchTrainer() {
        this(TrainerConfig.TrainingConfig.defaults());
    }

    public BaumWelchTrainer(TrainerConfig.TrainingConfig config) {
        this(config.forwardMode, config.degenerateRowPolicy, config.stochasticTolerance);
    }

    public BaumWelchTrainer(ForwardMode forwardMode, DegenerateRowPolicy degenerateRowPolicy, double tolerance) {
        this.forwardRecursion = new ForwardRecursion(forwardMode);
        this.updater = new ModelUpdater(degenerateRowPolicy);
        this.validator = new ModelValidator(tolerance);
    }

    public FitResult fit(int[] observations, double[] startProb, double[][] transitionProb,
            double[][] emissionProb, int iterations) {
        return fit(observations, startProb, transitionProb, emissionProb, iterations, false);
    }

    public FitResult fit(int[] observations, double[] startProb, double[][] transitionProb,
            double[][] emissionProb, int iterations, boolean verbose) {
        return fit(ObservationSequence.of(observations), new HmmModel(startProb, transitionProb, emissionProb),
                iterations, verbose);
    }

    public FitResult fit(ObservationSequence obs, HmmModel initial, int iterations, boolean verbose) {
        if (iterations < 1) {
            throw new IterationCountInvalidException(iterations);
        }
        validator.validate(initial, obs);

        logger.info("Starting Baum-Welch: states={}, symbols={}, length={}, iterations={}, forwardMode={}",
                initial.getNumStates(), initial.getNumSymbols(), obs.length(), iterations,
                forwardRecursion.getMode());
        long startTime = System.currentTimeMillis();

        HmmModel model = initial;
        ConvergenceTrace trace = new ConvergenceTrace();

        for (int iter = 1; iter <= iterations; iter++) {
            ExpectedCounts counts = expectation(model, obs);
            HmmModel next = updater.update(model, counts);
            double divergence = ModelUpdater.divergence(model, next);

            trace.record(iter, divergence, counts.getLogLikelihood());
            report(iter, next, divergence, counts.getLogLikelihood(), verbose);
            model = next;
        }

        double finalLogLikelihood = logLikelihood(model, obs);
        long duration = System.currentTimeMillis() - startTime;
        logger.info("Training complete in {} ms, final log-likelihood = {}", duration, finalLogLikelihood);

        return new FitResult(model, trace, finalLogLikelihood);
    }

    /**
     * E-step for one iteration: forward, backward and expected counts.
     */
    public ExpectedCounts expectation(HmmModel model, ObservationSequence obs) {
        double[][] forward = forwardRecursion.compute(model, obs);
        double[][] backward = backwardRecursion.compute(model, obs);
        return estimator.estimate(model, obs, forward, backward);
    }

    public double logLikelihood(HmmModel model, ObservationSequence obs) {
        return ForwardRecursion.logLikelihood(forwardRecursion.compute(model, obs));
    }

    private void report(int iter, HmmModel model, double divergence, double logLikelihood, boolean verbose) {
        if (verbose) {
            logger.info("Iteration {}: divergence = {}, log-likelihood = {}", iter, divergence, logLikelihood);
            logger.info("Iteration {} transition:\n{}", iter, format(model.getTransitionProb()));
            logger.info("Iteration {} emission:\n{}", iter, format(model.getEmissionProb()));
        } else if (logger.isDebugEnabled()) {
            logger.debug("Iteration {}: divergence = {}, log-likelihood = {}", iter, divergence, logLikelihood);
        }
    }

    private static String format(double[][] m) {
        StringBuilder sb = new StringBuilder();
        for (double[] row : m) {
            sb.append("  ").append(Arrays.toString(row)).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
