package com.baumwelch.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Packs vectors and row-major matrices into big-endian double blobs for the
 * SQLite store.
 */
public class DoubleArrayCodec {

    public static byte[] toBytes(double[] values) {
        if (values == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        buffer.asDoubleBuffer().put(values);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] values = new double[buffer.remaining()];
        buffer.get(values);
        return values;
    }

    public static byte[] matrixToBytes(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        int cols = matrix.length == 0 ? 0 : matrix[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(matrix.length * cols * Double.BYTES);
        DoubleBuffer doubles = buffer.asDoubleBuffer();
        for (double[] row : matrix) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Matrix rows must all have " + cols + " columns");
            }
            doubles.put(row);
        }
        return buffer.array();
    }

    public static double[][] matrixFromBytes(byte[] bytes, int rows, int cols) {
        if (bytes == null) {
            return null;
        }
        double[] flat = fromBytes(bytes);
        if (flat.length != rows * cols) {
            throw new IllegalArgumentException(
                    "Blob holds " + flat.length + " doubles, expected " + rows + "x" + cols);
        }
        double[][] matrix = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(flat, i * cols, matrix[i], 0, cols);
        }
        return matrix;
    }
}
