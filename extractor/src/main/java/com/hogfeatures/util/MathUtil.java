package com.hogfeatures.util;

public class MathUtil {

    /**
     * Sum of the elements. Histogram weights are non-negative, so this is the L1
     * norm for every vector the extractor feeds it.
     */
    public static double sum(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v;
        }
        return s;
    }

    /**
     * Sum of squared elements (squared L2 norm).
     */
    public static double sumOfSquares(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v * v;
        }
        return s;
    }

    /**
     * Divides every element in place by the given divisor.
     */
    public static void divideInPlace(double[] x, double divisor) {
        for (int i = 0; i < x.length; i++) {
            x[i] /= divisor;
        }
    }

    /**
     * Clamps every element in place to at most {@code ceiling}.
     */
    public static void clipInPlace(double[] x, double ceiling) {
        for (int i = 0; i < x.length; i++) {
            if (x[i] > ceiling) {
                x[i] = ceiling;
            }
        }
    }

    public static void sqrtInPlace(double[] x) {
        for (int i = 0; i < x.length; i++) {
            x[i] = Math.sqrt(x[i]);
        }
    }

    /**
     * Returns the maximum value, or 0 for an empty array.
     */
    public static double max(double[] x) {
        double best = 0.0;
        for (int i = 0; i < x.length; i++) {
            if (i == 0 || x[i] > best) {
                best = x[i];
            }
        }
        return best;
    }
}
