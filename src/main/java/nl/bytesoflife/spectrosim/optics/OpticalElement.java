package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

/**
 * A wavelength-dependent transform in the optical train: either a single stage or a
 * composite pipeline of them.
 */
public interface OpticalElement {

    String getLabel();

    /**
     * Transmittance at every axis point, including multiplicity but excluding any
     * background emission.
     */
    double[] getT(SpectralAxis axis);

    /**
     * Threads a spectral density through this element. {@code density} is expressed per unit
     * of {@code axis}, and so is the result.
     */
    double[] apply(SpectralAxis axis, double[] density, SpectrumKind kind);

    double getMultiplicity();

    void setMultiplicity(double multiplicity);

    /**
     * Multiplicity rounded to the nearest non-negative integer.
     */
    default int getRepeatCount() {
        return roundMultiplicity(getMultiplicity());
    }

    static int roundMultiplicity(double multiplicity) {
        if (Double.isNaN(multiplicity)) {
            throw new IllegalArgumentException("Multiplicity must be a number");
        }
        return (int) Math.max(0, Math.round(multiplicity));
    }
}
