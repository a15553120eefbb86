package com.baumwelch.server.hmm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaumWelchTrainerTest {

    private final BaumWelchTrainer trainer = new BaumWelchTrainer();

    @Test
    void testConcreteTwoStateScenario() {
        int[] seq = { 1, 2, 1, 2 };
        double[] start = { 0.5, 0.5 };
        double[][] transition = { { 0.5, 0.5 }, { 0.5, 0.5 } };
        double[][] emission = { { 0.6, 0.4 }, { 0.4, 0.6 } };

        FitResult result = trainer.fit(seq, start, transition, emission, 1);

        // log-likelihood of the initial model, by enumeration over 2^4 paths
        HmmModel initial = new HmmModel(start, transition, emission);
        double expected = Math.log(HmmTestSupport.bruteForceLikelihood(initial, seq));
        assertEquals(expected, result.getTrace().getLogLikelihoods().get(0), 1e-6);

        HmmTestSupport.assertRowStochastic(result.getTransitionProb(), 1e-9);
        HmmTestSupport.assertRowStochastic(result.getEmissionProb(), 1e-9);

        double[][] trace = result.getTrace().toMatrix();
        assertEquals(2, trace.length);
        assertEquals(1, trace[0].length);
        assertEquals(1.0, trace[0][0], 0.0);
        assertTrue(trace[1][0] >= 0.0);
    }

    @Test
    void testRowsStayStochasticAfterEveryIteration() {
        HmmModel model = HmmTestSupport.twoStateThreeSymbolModel();
        ObservationSequence obs = ObservationSequence.of(HmmTestSupport.mixedSequence());

        for (int i = 0; i < 10; i++) {
            FitResult result = trainer.fit(obs, model, 1, false);
            HmmTestSupport.assertRowStochastic(result.getTransitionProb(), 1e-9);
            HmmTestSupport.assertRowStochastic(result.getEmissionProb(), 1e-9);
            model = result.getModel();
        }
    }

    @Test
    void testLogLikelihoodNeverDecreases() {
        FitResult result = trainer.fit(ObservationSequence.of(HmmTestSupport.mixedSequence()),
                HmmTestSupport.twoStateThreeSymbolModel(), 25, false);

        List<Double> ll = result.getTrace().getLogLikelihoods();
        for (int i = 1; i < ll.size(); i++) {
            assertTrue(ll.get(i) >= ll.get(i - 1) - 1e-9,
                    "log-likelihood dropped at iteration " + (i + 1) + ": " + ll.get(i - 1) + " -> " + ll.get(i));
        }
        assertTrue(result.getFinalLogLikelihood() >= ll.get(ll.size() - 1) - 1e-9);
    }

    @Test
    void testLinearModeTrainsLikeLogMode() {
        BaumWelchTrainer linear = new BaumWelchTrainer(ForwardMode.LINEAR_STATE_SUM, DegenerateRowPolicy.UNIFORM,
                1e-6);
        ObservationSequence obs = ObservationSequence.of(HmmTestSupport.mixedSequence());
        HmmModel model = HmmTestSupport.twoStateThreeSymbolModel();

        FitResult a = trainer.fit(obs, model, 5, false);
        FitResult b = linear.fit(obs, model, 5, false);
        for (int i = 0; i < 2; i++) {
            assertArrayEquals(a.getTransitionProb()[i], b.getTransitionProb()[i], 1e-9);
            assertArrayEquals(a.getEmissionProb()[i], b.getEmissionProb()[i], 1e-9);
        }
    }

    @Test
    void testTraceShape() {
        FitResult result = trainer.fit(ObservationSequence.of(HmmTestSupport.mixedSequence()),
                HmmTestSupport.twoStateThreeSymbolModel(), 7, true);

        double[][] trace = result.getTrace().toMatrix();
        assertEquals(2, trace.length);
        assertEquals(7, trace[0].length);
        assertEquals(7, trace[1].length);
        assertEquals(1.0, trace[0][0], 0.0);
        assertEquals(7.0, trace[0][6], 0.0);
        for (int i = 0; i < 7; i++) {
            assertEquals(i + 1, trace[0][i], 0.0);
            assertTrue(trace[1][i] >= 0.0);
        }
        assertEquals(7, result.getTrace().getLogLikelihoods().size());
    }

    @Test
    void testSingleStateModelKeepsSelfLoop() {
        double[][] emission = { { 0.3, 0.7 } };
        int[][] sequences = { { 1, 2, 2, 1, 2 }, { 2 }, { 1, 1, 1 } };

        for (int[] seq : sequences) {
            FitResult result = trainer.fit(seq, new double[] { 1.0 }, new double[][] { { 1.0 } }, emission, 3);
            assertEquals(1.0, result.getTransitionProb()[0][0], 1e-12);
            HmmTestSupport.assertRowStochastic(result.getEmissionProb(), 1e-12);
        }

        FitResult result = trainer.fit(new int[] { 1, 2, 2, 1, 2 }, new double[] { 1.0 },
                new double[][] { { 1.0 } }, emission, 1);
        assertArrayEquals(new double[] { 0.4, 0.6 }, result.getEmissionProb()[0], 1e-12);
    }

    @Test
    void testStartProbIsNeverReestimated() {
        HmmModel model = HmmTestSupport.twoStateThreeSymbolModel();
        FitResult result = trainer.fit(ObservationSequence.of(HmmTestSupport.mixedSequence()), model, 10, false);
        assertArrayEquals(model.getStartProb(), result.getModel().getStartProb(), 0.0);
    }

    @Test
    void testInputModelIsNotMutated() {
        double[][] transition = { { 0.7, 0.3 }, { 0.4, 0.6 } };
        double[][] emission = { { 0.5, 0.4, 0.1 }, { 0.1, 0.3, 0.6 } };
        trainer.fit(HmmTestSupport.mixedSequence(), new double[] { 0.6, 0.4 }, transition, emission, 3);

        assertArrayEquals(new double[] { 0.7, 0.3 }, transition[0], 0.0);
        assertArrayEquals(new double[] { 0.1, 0.3, 0.6 }, emission[1], 0.0);
    }

    @Test
    void testSingleObservation() {
        FitResult result = trainer.fit(ObservationSequence.of(2), HmmTestSupport.twoStateThreeSymbolModel(), 2,
                false);
        // no transitions observed: rows fall back to uniform
        assertArrayEquals(new double[] { 0.5, 0.5 }, result.getTransitionProb()[0], 1e-12);
        assertEquals(1.0, result.getEmissionProb()[0][1], 1e-12);
        assertEquals(1.0, result.getEmissionProb()[1][1], 1e-12);
    }

    @Test
    void testUnreachableStateUniformPolicy() {
        HmmModel model = new HmmModel(
                new double[] { 1.0, 0.0 },
                new double[][] { { 1.0, 0.0 }, { 0.5, 0.5 } },
                new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } });

        FitResult result = trainer.fit(ObservationSequence.of(1, 2, 1), model, 1, false);
        assertArrayEquals(new double[] { 1.0, 0.0 }, result.getTransitionProb()[0], 1e-12);
        assertArrayEquals(new double[] { 0.5, 0.5 }, result.getTransitionProb()[1], 1e-12);
        assertArrayEquals(new double[] { 0.5, 0.5 }, result.getEmissionProb()[1], 1e-12);
    }

    @Test
    void testUnreachableStateFailPolicy() {
        BaumWelchTrainer strict = new BaumWelchTrainer(ForwardMode.LOG_SPACE, DegenerateRowPolicy.FAIL, 1e-6);
        HmmModel model = new HmmModel(
                new double[] { 1.0, 0.0 },
                new double[][] { { 1.0, 0.0 }, { 0.5, 0.5 } },
                new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } });

        DegenerateStatisticsException e = assertThrows(DegenerateStatisticsException.class,
                () -> strict.fit(ObservationSequence.of(1, 2, 1), model, 1, false));
        assertEquals("transitionProb", e.getMatrixName());
        assertEquals(1, e.getStateIndex());
    }

    @Test
    void testIterationCountMustBePositive() {
        HmmModel model = HmmTestSupport.twoStateThreeSymbolModel();
        ObservationSequence obs = ObservationSequence.of(1, 2);
        IterationCountInvalidException e = assertThrows(IterationCountInvalidException.class,
                () -> trainer.fit(obs, model, 0, false));
        assertEquals(0, e.getIterations());
        assertThrows(IterationCountInvalidException.class, () -> trainer.fit(obs, model, -3, false));
    }

    @Test
    void testInvalidInputRejectedBeforeTraining() {
        HmmModel model = HmmTestSupport.twoStateThreeSymbolModel();
        assertThrows(InvalidModelInputException.class,
                () -> trainer.fit(ObservationSequence.of(1, 4), model, 1, false));
        assertThrows(InvalidModelInputException.class,
                () -> trainer.fit(new int[] { 1, 2 }, new double[] { 0.5, 0.6 },
                        new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } },
                        new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } }, 1));
    }
}
