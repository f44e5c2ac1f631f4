package nl.bytesoflife.spectrosim.exposure;

import nl.bytesoflife.spectrosim.NoSignalException;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.detector.DetectorModel;
import nl.bytesoflife.spectrosim.detector.MaxExposure;
import nl.bytesoflife.spectrosim.detector.ReadNoise;
import nl.bytesoflife.spectrosim.math.Integration;
import nl.bytesoflife.spectrosim.math.SpecialFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Resumable computation of the distribution of the time to saturation.
 *
 * <p>For each candidate exposure time {@code t} the number of collected electrons is Poisson
 * with mean {@code rate · t}; the read-out value is that count over the gain plus Gaussian read
 * noise. The density at {@code t} is the probability that this read-out rounds to the
 * saturation count.
 *
 * <p>Work is split into {@link #step(Duration)} calls bounded by wall-clock time so that the
 * caller can report progress and stop at any point. No threads are used.
 */
public class ExposureTimeEstimator {

    private static final Logger log = LoggerFactory.getLogger(ExposureTimeEstimator.class);

    /** Above this mean the Poisson pmf is replaced by its normal approximation. */
    public static final double GAUSSIAN_CUTOFF = 20;

    /** Support of the electron count is {@code 0 .. SUPPORT_MULTIPLE · ceil(rate)}. */
    public static final int SUPPORT_MULTIPLE = 5;

    public static final int DEFAULT_POINTS = 1000;

    // normal pmf terms further out than this are below double precision
    private static final double TAIL_SIGMAS = 40;

    private static final Duration MAX_BUDGET = Duration.ofNanos(Long.MAX_VALUE);

    private final double electronRate;
    private final double gain;
    private final ReadNoise readNoise;
    private final double saturation;
    private final double approximateExposureTime;
    private final double[] exposureTimes;
    private final double[] density;
    private int index;

    public ExposureTimeEstimator(double electronRate, double gain, ReadNoise readNoise, double saturation, int points) {
        this(electronRate, gain, readNoise, saturation, points, approximate(electronRate, gain, saturation));
    }

    private ExposureTimeEstimator(double electronRate, double gain, ReadNoise readNoise, double saturation,
                                  int points, double approximateExposureTime) {
        if (points < 2) {
            throw new IllegalArgumentException("Exposure time grid needs at least 2 points: " + points);
        }
        if (!(gain > 0)) {
            throw new IllegalArgumentException("Gain must be positive: " + gain);
        }
        this.electronRate = electronRate;
        this.gain = gain;
        this.readNoise = readNoise;
        this.saturation = saturation;
        this.approximateExposureTime = approximateExposureTime;

        double spread = Math.sqrt(approximateExposureTime);
        double min = Math.max(0, approximateExposureTime - spread);
        double max = approximateExposureTime + spread;
        this.exposureTimes = new double[points];
        for (int i = 0; i < points; i++) {
            exposureTimes[i] = min + (max - min) * i / (points - 1);
        }
        this.density = new double[points];
    }

    /**
     * Estimator for the brightest sample of {@code axis} as seen by {@code detector}.
     *
     * @throws NoSignalException if the detector sees no signal on the axis
     */
    public static ExposureTimeEstimator forDetector(DetectorModel detector, SpectralAxis axis,
                                                    double saturation, int points) {
        MaxExposure max = detector.maxExposureTime(axis, saturation);
        double rate = detector.electronRate(axis.subset(max.index()))[0];
        log.info("Integration time estimate: {} s at {} m", max.exposureTime(), max.wavelength());
        return new ExposureTimeEstimator(rate, detector.gain(), detector.readNoise(), saturation,
                points, max.exposureTime());
    }

    private static double approximate(double electronRate, double gain, double saturation) {
        double countRate = electronRate / gain;
        if (!(Math.rint(countRate) > 0)) {
            throw new NoSignalException();
        }
        return saturation / countRate;
    }

    /**
     * Processes grid points until {@code budget} has elapsed. At least one point is processed
     * per call unless the estimator is already done, in which case this is a no-op.
     */
    public void step(Duration budget) {
        if (done()) return;

        long nanos = budget.compareTo(MAX_BUDGET) > 0 ? Long.MAX_VALUE : budget.toNanos();
        long deadline = System.nanoTime() + nanos;
        int start = index;
        do {
            density[index] = densityAt(exposureTimes[index]);
            index++;
        } while (index < exposureTimes.length && System.nanoTime() - deadline < 0);

        log.trace("Processed points {}..{} of {}", start, index, exposureTimes.length);
    }

    double densityAt(double exposureTime) {
        double sigma = readNoise.sigma(exposureTime) / gain;
        double rate = electronRate * exposureTime;
        long max = SUPPORT_MULTIPLE * (long) Math.ceil(rate);
        double lower = saturation - .5;
        double upper = saturation + .5;

        long from = 0;
        long to = max;
        boolean gaussian = rate > GAUSSIAN_CUTOFF;
        if (gaussian) {
            double sd = Math.sqrt(rate);
            from = (long) Math.max(0, Math.floor(rate - TAIL_SIGMAS * sd));
            to = Math.min(max, (long) Math.ceil(rate + TAIL_SIGMAS * sd));
        }

        double sum = 0;
        for (long k = from; k <= to; k++) {
            double pmf = gaussian
                    ? SpecialFunctions.normalPdf(k, rate, Math.sqrt(rate))
                    : SpecialFunctions.poissonPmf((int) k, rate);
            if (pmf == 0) continue;
            sum += pmf * SpecialFunctions.normalInterval(lower, upper, k / gain, sigma);
        }
        return sum;
    }

    public double progress() {
        return (double) index / exposureTimes.length;
    }

    public boolean done() {
        return index == exposureTimes.length;
    }

    public EstimatorState state() {
        if (index == 0) return EstimatorState.INITIALIZED;
        return done() ? EstimatorState.DONE : EstimatorState.WORKING;
    }

    public double getApproximateExposureTime() {
        return approximateExposureTime;
    }

    public double getSaturation() {
        return saturation;
    }

    /**
     * Normalized density over the grid. Points not yet processed read as zero, so calling this
     * before {@link #done()} yields a partial result.
     */
    public ExposureTimeDistribution result() {
        double[] p = density.clone();
        for (int i = 0; i < p.length; i++) {
            if (Double.isNaN(p[i])) p[i] = 0;
        }
        double k = Integration.trapezoid(p, exposureTimes);
        if (k == 0) {
            k = 1;
        }
        for (int i = 0; i < p.length; i++) {
            p[i] /= k;
        }
        return new ExposureTimeDistribution(exposureTimes, p);
    }
}
