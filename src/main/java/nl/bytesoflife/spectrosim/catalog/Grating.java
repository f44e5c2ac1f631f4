package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;

/**
 * A spectrograph grating and the band it covers.
 *
 * @param name           grating identifier, e.g. "MR2"
 * @param filter         name of the passband filter used with this grating
 * @param equalizer      name of the equalizer used with this grating
 * @param resolvingPower R = λ / Δλ
 * @param minWavelength  lower band edge (m)
 * @param maxWavelength  upper band edge (m)
 */
public record Grating(
        String name,
        String filter,
        String equalizer,
        double resolvingPower,
        double minWavelength,
        double maxWavelength
) {

    public Grating {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Grating name must not be blank");
        }
        if (!(resolvingPower > 0)) {
            throw new IllegalArgumentException("Resolving power must be positive: " + resolvingPower);
        }
        if (!(minWavelength > 0 && maxWavelength > minWavelength)) {
            throw new IllegalArgumentException("Invalid band for grating " + name);
        }
    }

    public double centreWavelength() {
        return 0.5 * (minWavelength + maxWavelength);
    }

    /**
     * Uniform wavelength axis of {@code samples} points spanning the band.
     */
    public SpectralAxis samplingGrid(int samples) {
        return SpectralAxis.wavelengthRange(minWavelength, maxWavelength, samples);
    }
}
