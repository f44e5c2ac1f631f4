package nl.bytesoflife.spectrosim.detector;

/**
 * Two-regime read noise: {@code low} electrons RMS for exposures shorter than
 * {@code thresholdSeconds}, {@code high} for exposures at or above it.
 */
public record ReadNoise(double low, double high, double thresholdSeconds) {

    public static final double DEFAULT_THRESHOLD = 120;

    public ReadNoise {
        if (low < 0 || high < 0) {
            throw new IllegalArgumentException("Read noise must be >= 0");
        }
        if (thresholdSeconds < 0) {
            throw new IllegalArgumentException("Read noise threshold must be >= 0");
        }
    }

    public static ReadNoise constant(double sigma) {
        return new ReadNoise(sigma, sigma, DEFAULT_THRESHOLD);
    }

    public double sigma(double exposureTime) {
        return exposureTime < thresholdSeconds ? low : high;
    }
}
