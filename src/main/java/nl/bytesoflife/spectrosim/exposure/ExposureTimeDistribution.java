package nl.bytesoflife.spectrosim.exposure;

import nl.bytesoflife.spectrosim.math.Integration;

/**
 * Probability density of the exposure time at which a pixel first reads the saturation count.
 *
 * @param exposureTimes grid of exposure times (s), increasing
 * @param density       probability density at each grid point (1/s)
 */
public record ExposureTimeDistribution(double[] exposureTimes, double[] density) {

    public ExposureTimeDistribution {
        if (exposureTimes.length != density.length) {
            throw new IllegalArgumentException("Exposure time grid and density differ in length");
        }
        exposureTimes = exposureTimes.clone();
        density = density.clone();
    }

    @Override
    public double[] exposureTimes() {
        return exposureTimes.clone();
    }

    @Override
    public double[] density() {
        return density.clone();
    }

    public int size() {
        return exposureTimes.length;
    }

    /**
     * Most probable exposure time.
     */
    public double peakExposureTime() {
        int best = 0;
        for (int i = 1; i < density.length; i++) {
            if (density[i] > density[best]) best = i;
        }
        return exposureTimes[best];
    }

    public double integral() {
        return Integration.trapezoid(density, exposureTimes);
    }
}
