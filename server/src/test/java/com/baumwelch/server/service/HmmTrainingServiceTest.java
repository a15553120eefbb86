package com.baumwelch.server.service;

import com.baumwelch.db.TrainingRun;
import com.baumwelch.server.hmm.DegenerateRowPolicy;
import com.baumwelch.server.hmm.ForwardMode;
import com.baumwelch.server.hmm.HmmModel;
import com.baumwelch.server.hmm.InvalidModelInputException;
import com.baumwelch.server.hmm.TrainerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class HmmTrainingServiceTest {

    @TempDir
    Path tmp;

    private HmmTrainingService service;

    @BeforeEach
    public void setup() {
        TrainerConfig.ConfigRoot config = TrainerConfig.defaults();
        config.training.iterations = 3;
        service = new HmmTrainingService(config, tmp.resolve("runs.db").toString());
        service.init();
    }

    @Test
    public void testLoadConfigFromDefaultFile() {
        TrainerConfig.ConfigRoot config = HmmTrainingService.loadConfig();
        assertNotNull(config.training);
        // values from hmm_config.json
        assertEquals(20, config.training.iterations);
        assertEquals(ForwardMode.LOG_SPACE, config.training.forwardMode);
        assertEquals(DegenerateRowPolicy.UNIFORM, config.training.degenerateRowPolicy);
        assertEquals(1.0e-6, config.training.stochasticTolerance, 1e-12);
        assertEquals("uniform", config.initialization.strategy);
        assertEquals(Long.valueOf(42L), config.initialization.seed);
    }

    @Test
    public void testFitWithSuppliedModelIsStored() {
        HmmModel initial = new HmmModel(new double[] { 0.5, 0.5 },
                new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } },
                new double[][] { { 0.6, 0.4 }, { 0.4, 0.6 } });

        HmmTrainingService.FitOutcome outcome = service.fit(new int[] { 1, 2, 1, 2 }, initial, null, null, 2,
                false);
        assertTrue(outcome.getRunId() > 0);
        assertEquals(2, outcome.getResult().getTrace().size());

        Optional<TrainingRun> stored = service.findRun(outcome.getRunId());
        assertTrue(stored.isPresent());
        assertEquals(2, stored.get().getIterations());
        assertEquals(1, service.recentRuns(5).size());
    }

    @Test
    public void testFitInitializesModelWhenMissing() {
        HmmTrainingService.FitOutcome outcome = service.fit(new int[] { 1, 3, 3, 2, 1 }, null, 2, null, null,
                null);

        // configured iteration count, alphabet size inferred from the sequence
        assertEquals(3, outcome.getResult().getTrace().size());
        assertEquals(3, outcome.getResult().getModel().getNumSymbols());
        assertArrayEquals(new double[] { 0.5, 0.5 }, outcome.getResult().getModel().getStartProb(), 1e-12);
    }

    @Test
    public void testFitWithoutModelRequiresStateCount() {
        assertThrows(InvalidModelInputException.class,
                () -> service.fit(new int[] { 1, 2 }, null, null, null, null, null));
    }

    @Test
    public void testInitializeUsesConfiguredStrategy() {
        HmmModel m = service.initialize(3, 4, null, null);
        assertEquals(0.7 / 3 + 0.3, m.transition(0, 0), 1e-12);

        HmmModel r1 = service.initialize(3, 4, "random", 5L);
        HmmModel r2 = service.initialize(3, 4, "random", 5L);
        assertArrayEquals(r1.getEmissionProb()[2], r2.getEmissionProb()[2], 0.0);
    }

    @Test
    public void testMissingRun() {
        assertFalse(service.findRun(12345).isPresent());
    }
}
