package com.baumwelch.server.hmm;

public class MathUtil {

    /**
     * Natural log that maps a zero probability to negative infinity instead of
     * failing.
     */
    public static double safeLog(double p) {
        if (p <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        return Math.log(p);
    }

    /**
     * Streaming two-term log-sum-exp: log(exp(acc) + exp(term)).
     * Either argument may be negative infinity; the result is never NaN for
     * non-NaN inputs.
     */
    public static double logAdd(double acc, double term) {
        if (term == Double.NEGATIVE_INFINITY) {
            return acc;
        }
        if (acc == Double.NEGATIVE_INFINITY) {
            return term;
        }
        if (acc > term) {
            return acc + Math.log1p(Math.exp(term - acc));
        }
        return term + Math.log1p(Math.exp(acc - term));
    }

    /**
     * Computes log(sum(exp(x_i))) using the "max trick":
     * max + log(sum(exp(x_i - max))).
     * Returns negative infinity for an empty array or when every term is
     * negative infinity.
     */
    public static double logSumExp(double[] x) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            if (v > max)
                max = v;
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0.0;
        for (double v : x) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Frobenius (L2) norm of a - b.
     */
    public static double frobeniusDistance(double[][] a, double[][] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Matrices must have same number of rows");
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            if (a[i].length != b[i].length) {
                throw new IllegalArgumentException("Matrices must have same number of columns");
            }
            for (int j = 0; j < a[i].length; j++) {
                double d = a[i][j] - b[i][j];
                sum += d * d;
            }
        }
        return Math.sqrt(sum);
    }

    public static double[] column(double[][] m, int col) {
        double[] out = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i][col];
        }
        return out;
    }

    public static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }

    public static double rowSum(double[] row) {
        double sum = 0.0;
        for (double v : row) {
            sum += v;
        }
        return sum;
    }

    public static boolean containsNaN(double[][] m) {
        for (double[] row : m) {
            for (double v : row) {
                if (Double.isNaN(v))
                    return true;
            }
        }
        return false;
    }
}
