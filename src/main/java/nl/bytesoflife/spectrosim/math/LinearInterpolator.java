package nl.bytesoflife.spectrosim.math;

import java.util.Arrays;

/**
 * Piecewise-linear interpolation over a strictly increasing abscissa. Queries outside the
 * tabulated range return the configured fill value.
 */
public class LinearInterpolator {

    private final double[] x;
    private final double[] y;
    private final double fill;

    public LinearInterpolator(double[] x, double[] y, double fill) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Table columns differ in length: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("Interpolation table needs at least 2 rows");
        }
        for (int i = 1; i < x.length; i++) {
            if (!(x[i] > x[i - 1])) {
                throw new IllegalArgumentException("Table abscissa must be strictly increasing at row " + i);
            }
        }
        this.x = x.clone();
        this.y = y.clone();
        this.fill = fill;
    }

    public double evaluate(double q) {
        if (Double.isNaN(q) || q < x[0] || q > x[x.length - 1]) {
            return fill;
        }
        int idx = Arrays.binarySearch(x, q);
        if (idx >= 0) return y[idx];
        int hi = -idx - 1;
        int lo = hi - 1;
        double f = (q - x[lo]) / (x[hi] - x[lo]);
        return y[lo] + f * (y[hi] - y[lo]);
    }

    public double[] evaluate(double[] q) {
        double[] out = new double[q.length];
        for (int i = 0; i < q.length; i++) {
            out[i] = evaluate(q[i]);
        }
        return out;
    }

    public double minX() {
        return x[0];
    }

    public double maxX() {
        return x[x.length - 1];
    }
}
