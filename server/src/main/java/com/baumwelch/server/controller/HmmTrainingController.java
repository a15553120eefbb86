package com.baumwelch.server.controller;

import com.baumwelch.db.TrainingRun;
import com.baumwelch.server.hmm.ConvergenceTrace;
import com.baumwelch.server.hmm.FitResult;
import com.baumwelch.server.hmm.HmmModel;
import com.baumwelch.server.hmm.HmmTrainingException;
import com.baumwelch.server.hmm.InvalidModelInputException;
import com.baumwelch.server.service.HmmTrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/hmm")
public class HmmTrainingController {

    private static final Logger logger = LoggerFactory.getLogger(HmmTrainingController.class);
    private final HmmTrainingService trainingService;

    public HmmTrainingController(HmmTrainingService trainingService) {
        this.trainingService = trainingService;
    }

    public static class FitRequest {
        public int[] observations;
        public double[] startProb;
        public double[][] transitionProb;
        public double[][] emissionProb;
        // used only when no model is supplied
        public Integer numStates;
        public Integer numSymbols;
        public Integer iterations;
        public Boolean verbose;
    }

    public static class InitializeRequest {
        public int numStates;
        public int numSymbols;
        public String strategy;
        public Long seed;
    }

    public static class ModelResponse {
        public double[] startProb;
        public double[][] transitionProb;
        public double[][] emissionProb;

        static ModelResponse of(HmmModel model) {
            ModelResponse r = new ModelResponse();
            r.startProb = model.getStartProb();
            r.transitionProb = model.getTransitionProb();
            r.emissionProb = model.getEmissionProb();
            return r;
        }
    }

    public static class FitResponse {
        public long runId;
        public double[][] transitionProb;
        public double[][] emissionProb;
        public double[][] trace;
        public List<Double> logLikelihoods;
        public double finalLogLikelihood;

        static FitResponse of(long runId, FitResult result) {
            FitResponse r = new FitResponse();
            r.runId = runId;
            r.transitionProb = result.getTransitionProb();
            r.emissionProb = result.getEmissionProb();
            r.trace = result.getTrace().toMatrix();
            r.logLikelihoods = result.getTrace().getLogLikelihoods();
            r.finalLogLikelihood = result.getFinalLogLikelihood();
            return r;
        }

        static FitResponse of(TrainingRun run) {
            FitResponse r = new FitResponse();
            ConvergenceTrace trace = run.getTrace();
            r.runId = run.getId();
            r.transitionProb = run.getModel().getTransitionProb();
            r.emissionProb = run.getModel().getEmissionProb();
            r.trace = trace.toMatrix();
            r.logLikelihoods = trace.getLogLikelihoods();
            r.finalLogLikelihood = run.getFinalLogLikelihood();
            return r;
        }
    }

    @PostMapping("/fit")
    public ResponseEntity<FitResponse> fit(@RequestBody FitRequest request) {
        if (request.observations == null) {
            throw new InvalidModelInputException("observations are required");
        }
        HmmModel initial = null;
        boolean anyModel = request.startProb != null || request.transitionProb != null
                || request.emissionProb != null;
        if (anyModel) {
            if (request.startProb == null || request.transitionProb == null || request.emissionProb == null) {
                throw new InvalidModelInputException(
                        "startProb, transitionProb and emissionProb must be supplied together");
            }
            initial = new HmmModel(request.startProb, request.transitionProb, request.emissionProb);
        }

        logger.info("Received fit request: length={}, iterations={}", request.observations.length,
                request.iterations);

        HmmTrainingService.FitOutcome outcome = trainingService.fit(request.observations, initial,
                request.numStates, request.numSymbols, request.iterations, request.verbose);
        return ResponseEntity.ok(FitResponse.of(outcome.getRunId(), outcome.getResult()));
    }

    @PostMapping("/initialize")
    public ResponseEntity<ModelResponse> initialize(@RequestBody InitializeRequest request) {
        HmmModel model = trainingService.initialize(request.numStates, request.numSymbols, request.strategy,
                request.seed);
        return ResponseEntity.ok(ModelResponse.of(model));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<FitResponse> getRun(@PathVariable("id") long id) {
        return trainingService.findRun(id)
                .map(run -> ResponseEntity.ok(FitResponse.of(run)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(HmmTrainingException.class)
    public ResponseEntity<Map<String, String>> handleTrainingError(HmmTrainingException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(body);
    }
}
