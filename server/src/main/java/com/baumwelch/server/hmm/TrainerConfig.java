package com.baumwelch.server.hmm;

/**
 * Jackson-bound view of {@code hmm_config.json}. Every field has a default so
 * a partial file still yields a usable configuration.
 */
public class TrainerConfig {

    public static class ConfigRoot {
        public String data_directory;
        public TrainingConfig training = new TrainingConfig();
        public InitializationConfig initialization = new InitializationConfig();
    }

    public static class TrainingConfig {
        public int iterations = 20;
        public boolean verbose = false;
        public ForwardMode forwardMode = ForwardMode.LOG_SPACE;
        public DegenerateRowPolicy degenerateRowPolicy = DegenerateRowPolicy.UNIFORM;
        public double stochasticTolerance = ModelValidator.DEFAULT_TOLERANCE;

        public TrainingConfig() {
        }

        public TrainingConfig(int iterations, boolean verbose, ForwardMode forwardMode,
                DegenerateRowPolicy degenerateRowPolicy, double stochasticTolerance) {
            this.iterations = iterations;
            this.verbose = verbose;
            this.forwardMode = forwardMode;
            this.degenerateRowPolicy = degenerateRowPolicy;
            this.stochasticTolerance = stochasticTolerance;
        }

        public static TrainingConfig defaults() {
            return new TrainingConfig(20, false, ForwardMode.LOG_SPACE, DegenerateRowPolicy.UNIFORM,
                    ModelValidator.DEFAULT_TOLERANCE);
        }

        public TrainingConfig copy() {
            return new TrainingConfig(iterations, verbose, forwardMode, degenerateRowPolicy, stochasticTolerance);
        }
    }

    public static class InitializationConfig {
        public String strategy = "uniform";
        public Long seed;
    }

    public static ConfigRoot defaults() {
        return new ConfigRoot();
    }
}
