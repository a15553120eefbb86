package com.baumwelch.server.service;

import com.baumwelch.db.SqliteInitializer;
import com.baumwelch.db.TrainingRun;
import com.baumwelch.db.TrainingRunDao;
import com.baumwelch.server.hmm.BaumWelchTrainer;
import com.baumwelch.server.hmm.FitResult;
import com.baumwelch.server.hmm.HmmModel;
import com.baumwelch.server.hmm.InvalidModelInputException;
import com.baumwelch.server.hmm.ModelInitializer;
import com.baumwelch.server.hmm.ObservationSequence;
import com.baumwelch.server.hmm.TrainerConfig;
import com.baumwelch.server.util.DataPathResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Service
public class HmmTrainingService {

    private static final Logger logger = LoggerFactory.getLogger(HmmTrainingService.class);

    private final TrainerConfig.ConfigRoot config;
    private final BaumWelchTrainer trainer;
    private final String dbPath;
    private final TrainingRunDao runDao;

    public HmmTrainingService() {
        this(loadConfig(), DataPathResolver.resolveDbPath());
    }

    public HmmTrainingService(TrainerConfig.ConfigRoot config, String dbPath) {
        this.config = config;
        this.trainer = new BaumWelchTrainer(config.training);
        this.dbPath = dbPath;
        this.runDao = new TrainingRunDao(dbPath);
    }

    @PostConstruct
    public void init() {
        try {
            SqliteInitializer.initialize(dbPath);
            logger.info("Training run store ready at {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize training run store at " + dbPath, e);
        }
    }

    public TrainerConfig.ConfigRoot getConfig() {
        return config;
    }

    public static class FitOutcome {
        private final long runId;
        private final FitResult result;

        public FitOutcome(long runId, FitResult result) {
            this.runId = runId;
            this.result = result;
        }

        public long getRunId() {
            return runId;
        }

        public FitResult getResult() {
            return result;
        }
    }

    /**
     * Trains on the given sequence and stores the result.
     *
     * @param initial    starting model, or null to initialize one from the
     *                   configured strategy
     * @param numStates  required when {@code initial} is null
     * @param numSymbols when null and {@code initial} is null, the largest
     *                   observed symbol is used
     * @param iterations overrides the configured iteration count when non-null
     * @param verbose    overrides the configured verbosity when non-null
     */
    public FitOutcome fit(int[] observations, HmmModel initial, Integer numStates, Integer numSymbols,
            Integer iterations, Boolean verbose) {
        ObservationSequence obs = ObservationSequence.of(observations);
        HmmModel model = initial;
        if (model == null) {
            if (numStates == null) {
                throw new InvalidModelInputException("numStates is required when no initial model is given");
            }
            int k = numSymbols != null ? numSymbols : obs.maxSymbol();
            model = initialize(numStates, k, null, null);
        }

        int iters = iterations != null ? iterations : config.training.iterations;
        boolean verb = verbose != null ? verbose : config.training.verbose;

        FitResult result = trainer.fit(obs, model, iters, verb);

        try {
            long runId = runDao.insert(result);
            logger.info("Stored training run {}", runId);
            return new FitOutcome(runId, result);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to store training run", e);
        }
    }

    public HmmModel initialize(int numStates, int numSymbols, String strategy, Long seed) {
        String s = strategy != null ? strategy : config.initialization.strategy;
        Long sd = seed != null ? seed : config.initialization.seed;
        logger.debug("Initializing model: states={}, symbols={}, strategy={}", numStates, numSymbols, s);
        return ModelInitializer.create(s, numStates, numSymbols, sd);
    }

    public Optional<TrainingRun> findRun(long id) {
        try {
            return runDao.findById(id);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load training run " + id, e);
        }
    }

    public List<TrainingRun> recentRuns(int limit) {
        try {
            return runDao.listRecent(limit);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list training runs", e);
        }
    }

    /**
     * Reads {@code /hmm_config.json} from the classpath. Missing sections keep
     * their defaults; a missing or unreadable file yields the full defaults.
     */
    static TrainerConfig.ConfigRoot loadConfig() {
        try (InputStream is = HmmTrainingService.class.getResourceAsStream(DataPathResolver.CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", DataPathResolver.CONFIG_RESOURCE);
                return TrainerConfig.defaults();
            }
            ObjectMapper mapper = new ObjectMapper();
            TrainerConfig.ConfigRoot root = mapper.readValue(is, TrainerConfig.ConfigRoot.class);
            if (root.training == null) {
                root.training = TrainerConfig.TrainingConfig.defaults();
            }
            if (root.initialization == null) {
                root.initialization = new TrainerConfig.InitializationConfig();
            }
            return root;
        } catch (Exception e) {
            logger.warn("Failed to load {}, using defaults. Error: {}", DataPathResolver.CONFIG_RESOURCE,
                    e.getMessage());
            return TrainerConfig.defaults();
        }
    }
}
