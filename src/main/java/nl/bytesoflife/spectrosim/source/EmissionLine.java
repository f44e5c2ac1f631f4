package nl.bytesoflife.spectrosim.source;

/**
 * A single atomic emission line.
 *
 * @param wavelength   rest wavelength (m)
 * @param relativeFlux flux relative to the other lines of the same lamp
 * @param mass         emitter mass in proton masses, drives the Doppler width
 */
public record EmissionLine(double wavelength, double relativeFlux, double mass) {

    public EmissionLine {
        if (!(wavelength > 0)) {
            throw new IllegalArgumentException("Line wavelength must be positive");
        }
        if (relativeFlux < 0) {
            throw new IllegalArgumentException("Line flux must be >= 0");
        }
        if (!(mass > 0)) {
            throw new IllegalArgumentException("Line emitter mass must be positive");
        }
    }
}
