package nl.bytesoflife.spectrosim.exposure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

/**
 * Runs an estimator to completion on the calling thread, one time slice at a time, reporting
 * progress and checking for cancellation between slices.
 */
public class ExposureTimeDriver {

    private static final Logger log = LoggerFactory.getLogger(ExposureTimeDriver.class);

    public static final Duration DEFAULT_SLICE = Duration.ofMillis(500);

    private Duration slice = DEFAULT_SLICE;
    private BooleanSupplier cancelled = () -> false;
    private DoubleConsumer progressListener = p -> { };

    public ExposureTimeDriver withSlice(Duration slice) {
        if (slice.isNegative()) {
            throw new IllegalArgumentException("Slice must not be negative: " + slice);
        }
        this.slice = slice;
        return this;
    }

    public ExposureTimeDriver withCancellation(BooleanSupplier cancelled) {
        this.cancelled = cancelled;
        return this;
    }

    public ExposureTimeDriver withProgressListener(DoubleConsumer listener) {
        this.progressListener = listener;
        return this;
    }

    /**
     * @return the normalized distribution, or empty if cancelled before completion
     */
    public Optional<ExposureTimeDistribution> run(ExposureTimeEstimator estimator) {
        long start = System.currentTimeMillis();
        log.info("Estimating exposure time to {} counts (approx. {} s)",
                estimator.getSaturation(), estimator.getApproximateExposureTime());

        while (!estimator.done()) {
            if (cancelled.getAsBoolean()) {
                log.info("Exposure time estimation cancelled at {}%", Math.round(estimator.progress() * 100));
                return Optional.empty();
            }
            estimator.step(slice);
            progressListener.accept(estimator.progress());
        }

        ExposureTimeDistribution result = estimator.result();
        log.info("Exposure time estimation completed in {}ms, peak at {} s",
                System.currentTimeMillis() - start, result.peakExposureTime());
        return Optional.of(result);
    }
}
