package com.baumwelch.server.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace-separated matrices, one row per line. Blank lines and lines
 * starting with '#' are skipped.
 */
public class MatrixTextFormat {

    public static double[][] readMatrix(Path path) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] tokens = trimmed.split("\\s+");
                double[] row = new double[tokens.length];
                for (int i = 0; i < tokens.length; i++) {
                    try {
                        row[i] = Double.parseDouble(tokens[i]);
                    } catch (NumberFormatException e) {
                        throw new IOException(path + ":" + lineNo + ": not a number '" + tokens[i] + "'", e);
                    }
                }
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    /**
     * Reads a vector written either as a single row or as a single column.
     */
    public static double[] readVector(Path path) throws IOException {
        double[][] m = readMatrix(path);
        if (m.length == 1) {
            return m[0];
        }
        double[] v = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            if (m[i].length != 1) {
                throw new IOException(path + ": expected a single row or a single column");
            }
            v[i] = m[i][0];
        }
        return v;
    }

    public static int[] readSymbols(Path path) throws IOException {
        double[] v = readVector(path);
        int[] out = new int[v.length];
        for (int i = 0; i < v.length; i++) {
            if (v[i] != Math.rint(v[i])) {
                throw new IOException(path + ": symbol " + v[i] + " is not an integer");
            }
            out[i] = (int) v[i];
        }
        return out;
    }

    public static void writeMatrix(Path path, double[][] m) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (double[] row : m) {
                StringBuilder sb = new StringBuilder();
                for (int j = 0; j < row.length; j++) {
                    if (j > 0)
                        sb.append(' ');
                    sb.append(Double.toString(row[j]));
                }
                writer.write(sb.toString());
                writer.newLine();
            }
        }
    }
}
