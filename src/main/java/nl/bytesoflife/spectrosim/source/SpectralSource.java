package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Something that emits light: evaluates a spectral density over an axis, honoring its
 * current power scale and attenuation.
 */
public interface SpectralSource {

    String getLabel();

    SpectrumKind getKind();

    SourceRole getRole();

    void setRole(SourceRole role);

    default boolean hasRole(SourceRole role) {
        return getRole() != null && getRole() == role;
    }

    /**
     * Effective spectral density at every axis point, per unit of the axis kind.
     */
    double[] density(SpectralAxis axis);

    default double density(double wavelength) {
        return density(SpectralAxis.wavelength(wavelength))[0];
    }

    /**
     * Photon rate density: density divided by the photon energy, per unit of the axis kind.
     */
    double[] photonRate(SpectralAxis axis);

    /**
     * Wavelength of maximum density, or empty when it cannot be determined without a scan.
     */
    OptionalDouble peakWavelength();

    OptionalDouble peakFrequency();

    /**
     * Wavelength samples the source was built from, if any.
     */
    default Optional<double[]> nativeGrid() {
        return Optional.empty();
    }

    boolean isAdjustable();

    Double getNominalPower();

    void setNominalPowerRating(double power);

    void adjustPower(double power);

    double getPowerFactor();

    double getAttenuation();

    void setAttenuation(double attenuation);
}
