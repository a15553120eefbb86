package com.baumwelch.server.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MatrixTextFormatTest {

    @TempDir
    Path tmp;

    @Test
    void testReadMatrixSkipsCommentsAndBlankLines() throws IOException {
        Path file = tmp.resolve("m.txt");
        Files.write(file, "# transition\n0.7 0.3\n\n  0.4\t0.6  \n".getBytes(StandardCharsets.UTF_8));

        double[][] m = MatrixTextFormat.readMatrix(file);
        assertEquals(2, m.length);
        assertArrayEquals(new double[] { 0.7, 0.3 }, m[0], 0.0);
        assertArrayEquals(new double[] { 0.4, 0.6 }, m[1], 0.0);
    }

    @Test
    void testReadVectorAsRowOrColumn() throws IOException {
        Path row = tmp.resolve("row.txt");
        Path col = tmp.resolve("col.txt");
        Files.write(row, "0.5 0.5\n".getBytes(StandardCharsets.UTF_8));
        Files.write(col, "0.25\n0.75\n".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals(new double[] { 0.5, 0.5 }, MatrixTextFormat.readVector(row), 0.0);
        assertArrayEquals(new double[] { 0.25, 0.75 }, MatrixTextFormat.readVector(col), 0.0);
    }

    @Test
    void testReadSymbols() throws IOException {
        Path file = tmp.resolve("obs.txt");
        Files.write(file, "1 2 1 2 3\n".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(new int[] { 1, 2, 1, 2, 3 }, MatrixTextFormat.readSymbols(file));

        Files.write(file, "1 2.5\n".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> MatrixTextFormat.readSymbols(file));
    }

    @Test
    void testBadNumberReportsLine() throws IOException {
        Path file = tmp.resolve("bad.txt");
        Files.write(file, "0.5 0.5\n0.5 abc\n".getBytes(StandardCharsets.UTF_8));
        IOException e = assertThrows(IOException.class, () -> MatrixTextFormat.readMatrix(file));
        assertTrue(e.getMessage().contains(":2:"));
    }

    @Test
    void testWriteThenRead() throws IOException {
        Path file = tmp.resolve("out.txt");
        double[][] m = { { 0.125, 0.875 }, { 1.0 / 3, 2.0 / 3 }, { 1.0e-300, 1.0 - 1.0e-300 } };
        MatrixTextFormat.writeMatrix(file, m);

        double[][] back = MatrixTextFormat.readMatrix(file);
        assertEquals(m.length, back.length);
        for (int i = 0; i < m.length; i++) {
            assertArrayEquals(m[i], back[i], 0.0);
        }
    }
}
