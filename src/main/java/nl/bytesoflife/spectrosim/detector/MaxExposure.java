package nl.bytesoflife.spectrosim.detector;

/**
 * Linear estimate of the time to reach a count limit at the brightest axis sample.
 */
public record MaxExposure(double exposureTime, double wavelength, double frequency, int index) {
}
