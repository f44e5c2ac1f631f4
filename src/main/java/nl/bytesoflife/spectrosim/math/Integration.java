package nl.bytesoflife.spectrosim.math;

/**
 * Numerical quadrature over sampled functions.
 */
public final class Integration {

    private Integration() {
    }

    public static double trapezoid(double[] y, double[] x) {
        checkLengths(y, x);
        double sum = 0;
        for (int i = 1; i < x.length; i++) {
            sum += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        }
        return sum;
    }

    /**
     * Composite Simpson rule on possibly non-uniform samples. Pairs of intervals are
     * integrated with the parabola through three points; a trailing odd interval falls back
     * to the trapezoid rule.
     */
    public static double simpson(double[] y, double[] x) {
        checkLengths(y, x);
        int n = x.length;
        if (n < 3) return trapezoid(y, x);

        double sum = 0;
        int i = 0;
        for (; i + 2 < n; i += 2) {
            double h0 = x[i + 1] - x[i];
            double h1 = x[i + 2] - x[i + 1];
            double hs = h0 + h1;
            if (h0 == 0 || h1 == 0) {
                sum += 0.5 * (y[i] + y[i + 1]) * h0 + 0.5 * (y[i + 1] + y[i + 2]) * h1;
                continue;
            }
            sum += hs / 6.0 * (y[i] * (2 - h1 / h0)
                    + y[i + 1] * hs * hs / (h0 * h1)
                    + y[i + 2] * (2 - h0 / h1));
        }
        if (i + 1 < n) {
            sum += 0.5 * (y[i] + y[i + 1]) * (x[i + 1] - x[i]);
        }
        return sum;
    }

    private static void checkLengths(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("Sample arrays differ in length: " + y.length + " vs " + x.length);
        }
    }
}
