package com.baumwelch.server.tools;

import com.baumwelch.server.hmm.BaumWelchTrainer;
import com.baumwelch.server.hmm.FitResult;
import com.baumwelch.server.hmm.HmmTrainingException;
import com.baumwelch.server.util.MatrixTextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Offline tool to run Baum-Welch on matrices stored as text files.
 * Usage: HmmFitTool <obsFile> <startFile> <transitionFile> <emissionFile>
 * <iterations> <outDir> [--verbose]
 */
public class HmmFitTool {

    private static final Logger logger = LoggerFactory.getLogger(HmmFitTool.class);

    private static final String USAGE = "Usage: HmmFitTool <obsFile> <startFile> <transitionFile> "
            + "<emissionFile> <iterations> <outDir> [--verbose]";

    public static void main(String[] args) {
        if (args.length < 6) {
            System.err.println(USAGE);
            System.exit(1);
        }

        int iterations;
        try {
            iterations = Integer.parseInt(args[4]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid iteration count: " + args[4]);
            System.exit(1);
            return;
        }
        boolean verbose = args.length > 6 && "--verbose".equals(args[6]);

        try {
            run(Paths.get(args[0]), Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3]), iterations,
                    Paths.get(args[5]), verbose);
        } catch (IOException e) {
            logger.error("I/O failure: {}", e.getMessage(), e);
            System.exit(1);
        } catch (HmmTrainingException e) {
            System.err.println("Training failed: " + e.getMessage());
            System.exit(1);
        }
    }

    public static FitResult run(Path obsFile, Path startFile, Path transitionFile, Path emissionFile,
            int iterations, Path outDir, boolean verbose) throws IOException {
        int[] observations = MatrixTextFormat.readSymbols(obsFile);
        double[] start = MatrixTextFormat.readVector(startFile);
        double[][] transition = MatrixTextFormat.readMatrix(transitionFile);
        double[][] emission = MatrixTextFormat.readMatrix(emissionFile);
        logger.info("Loaded sequence of length {} and a {}-state model", observations.length, start.length);

        FitResult result = new BaumWelchTrainer().fit(observations, start, transition, emission, iterations,
                verbose);

        Files.createDirectories(outDir);
        MatrixTextFormat.writeMatrix(outDir.resolve("transition.txt"), result.getTransitionProb());
        MatrixTextFormat.writeMatrix(outDir.resolve("emission.txt"), result.getEmissionProb());
        MatrixTextFormat.writeMatrix(outDir.resolve("trace.txt"), result.getTrace().toMatrix());
        logger.info("Wrote results to {}", outDir.toAbsolutePath());
        return result;
    }
}
