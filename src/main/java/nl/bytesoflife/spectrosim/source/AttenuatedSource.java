package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import nl.bytesoflife.spectrosim.optics.OpticalElement;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A source seen through an optical train. Everything except the density is delegated to the
 * wrapped source, including its attenuation and power scale.
 */
public class AttenuatedSource extends AbstractSpectralSource {

    private final SpectralSource source;
    private final OpticalElement response;

    public AttenuatedSource(SpectralSource source, OpticalElement response) {
        this(source.getLabel() + " through " + response.getLabel(), source, response);
    }

    public AttenuatedSource(String label, SpectralSource source, OpticalElement response) {
        super(label);
        this.source = source;
        this.response = response;
    }

    public SpectralSource getSource() {
        return source;
    }

    public OpticalElement getResponse() {
        return response;
    }

    @Override
    public SpectrumKind getKind() {
        return source.getKind();
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        return density(SpectralAxis.wavelength(wavelengths));
    }

    @Override
    public double[] density(SpectralAxis axis) {
        return response.apply(axis, source.density(axis), source.getKind());
    }

    /**
     * Peak of the attenuated spectrum over the wrapped source's native grid, falling back to the
     * wrapped source's own peak.
     */
    @Override
    public OptionalDouble peakWavelength() {
        Optional<double[]> grid = source.nativeGrid();
        if (grid.isPresent() && grid.get().length > 0) {
            SpectralAxis axis = SpectralAxis.wavelength(grid.get());
            return OptionalDouble.of(argmaxDensity(axis));
        }
        return source.peakWavelength();
    }

    @Override
    public Optional<double[]> nativeGrid() {
        return source.nativeGrid();
    }

    @Override
    public SourceRole getRole() {
        return source.getRole();
    }

    @Override
    public void setRole(SourceRole role) {
        source.setRole(role);
    }

    @Override
    public boolean isAdjustable() {
        return source.isAdjustable();
    }

    @Override
    public Double getNominalPower() {
        return source.getNominalPower();
    }

    @Override
    public void setNominalPowerRating(double power) {
        source.setNominalPowerRating(power);
    }

    @Override
    public void adjustPower(double power) {
        source.adjustPower(power);
    }

    @Override
    public double getPowerFactor() {
        return source.getPowerFactor();
    }

    @Override
    public double getAttenuation() {
        return source.getAttenuation();
    }

    @Override
    public void setAttenuation(double attenuation) {
        source.setAttenuation(attenuation);
    }
}
