package nl.bytesoflife.spectrosim.math;

import java.util.random.RandomGenerator;

/**
 * Draws shot and read noise from a caller-supplied generator. The sampler never touches a
 * process-wide random source, so seeding the generator makes a simulation reproducible.
 */
public class NoiseSampler {

    private static final double PTRS_THRESHOLD = 10.0;

    private final RandomGenerator rng;

    public NoiseSampler(RandomGenerator rng) {
        if (rng == null) {
            throw new IllegalArgumentException("Random generator must not be null");
        }
        this.rng = rng;
    }

    public double gaussian(double mean, double sigma) {
        if (sigma <= 0) return mean;
        return mean + sigma * rng.nextGaussian();
    }

    /**
     * Poisson variate with the given mean. Small means use Knuth's multiplication method,
     * larger ones Hörmann's transformed rejection (PTRS).
     */
    public long poisson(double mean) {
        if (mean <= 0) return 0;
        if (mean < PTRS_THRESHOLD) {
            return poissonMultiplication(mean);
        }
        return poissonPtrs(mean);
    }

    private long poissonMultiplication(double mean) {
        double limit = Math.exp(-mean);
        long k = 0;
        double p = rng.nextDouble();
        while (p > limit) {
            k++;
            p *= rng.nextDouble();
        }
        return k;
    }

    private long poissonPtrs(double mean) {
        double slam = Math.sqrt(mean);
        double loglam = Math.log(mean);
        double b = 0.931 + 2.53 * slam;
        double a = -0.059 + 0.02483 * b;
        double invalpha = 1.1239 + 1.1328 / (b - 3.4);
        double vr = 0.9277 - 3.6224 / (b - 2);

        while (true) {
            double u = rng.nextDouble() - 0.5;
            double v = rng.nextDouble();
            double us = 0.5 - Math.abs(u);
            long k = (long) Math.floor((2 * a / us + b) * u + mean + 0.43);

            if (us >= 0.07 && v <= vr) {
                return k;
            }
            if (k < 0 || (us < 0.013 && v > us)) {
                continue;
            }
            double lhs = Math.log(v) + Math.log(invalpha) - Math.log(a / (us * us) + b);
            double rhs = -mean + k * loglam - SpecialFunctions.logGamma(k + 1.0);
            if (lhs <= rhs) {
                return k;
            }
        }
    }
}
