package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import nl.bytesoflife.spectrosim.math.Integration;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lambertian emitter of a given area: turns a radiance source into a spectral power density
 * by integrating over the hemisphere ({@code π × area}).
 *
 * <p>Power rating lives on the wrapped radiance source, so {@link #adjustPower(double)} and the
 * rating accessors delegate to it. Attenuation is kept on this radiator.
 */
public class IsotropicRadiatorSource extends AbstractSpectralSource {

    public static final double DEFAULT_POWER_MIN_WAVELENGTH = 450e-9;
    public static final double DEFAULT_POWER_MAX_WAVELENGTH = 2400e-9;
    public static final int DEFAULT_POWER_SAMPLES = 1000;

    private final SpectralSource radiance;
    private final double area;

    public IsotropicRadiatorSource(String label, SpectralSource radiance, double area) {
        super(label);
        if (radiance.getKind() != SpectrumKind.RADIANCE) {
            throw new IllegalArgumentException("Isotropic radiator '" + label + "' needs a radiance source, got "
                    + radiance.getKind());
        }
        if (!(area > 0)) {
            throw new IllegalArgumentException("Radiator area must be positive: " + area);
        }
        this.radiance = radiance;
        this.area = area;
    }

    public SpectralSource getRadiance() {
        return radiance;
    }

    public double getArea() {
        return area;
    }

    @Override
    public SpectrumKind getKind() {
        return SpectrumKind.POWER_DENSITY;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        return rawDensity(SpectralAxis.wavelength(wavelengths));
    }

    @Override
    protected double[] rawDensity(SpectralAxis axis) {
        double[] inner = radiance.density(axis);
        double[] out = new double[inner.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.PI * area * inner[i];
        }
        return out;
    }

    @Override
    public double[] density(SpectralAxis axis) {
        // the power factor is already inside the wrapped radiance
        double f = 1 - getAttenuation();
        double[] raw = rawDensity(axis);
        for (int i = 0; i < raw.length; i++) {
            raw[i] *= f;
        }
        return raw;
    }

    /**
     * Total emitted power between two wavelengths, trapezoid rule over {@code samples} points.
     */
    public double integratePower(double minWavelength, double maxWavelength, int samples) {
        SpectralAxis axis = SpectralAxis.wavelengthRange(minWavelength, maxWavelength, samples);
        return Integration.trapezoid(density(axis), axis.values());
    }

    public double integratePower() {
        return integratePower(DEFAULT_POWER_MIN_WAVELENGTH, DEFAULT_POWER_MAX_WAVELENGTH, DEFAULT_POWER_SAMPLES);
    }

    @Override
    public OptionalDouble peakWavelength() {
        return radiance.peakWavelength();
    }

    @Override
    public OptionalDouble peakFrequency() {
        return radiance.peakFrequency();
    }

    @Override
    public Optional<double[]> nativeGrid() {
        return radiance.nativeGrid();
    }

    @Override
    public boolean isAdjustable() {
        return radiance.isAdjustable();
    }

    @Override
    public Double getNominalPower() {
        return radiance.getNominalPower();
    }

    @Override
    public void setNominalPowerRating(double power) {
        radiance.setNominalPowerRating(power);
    }

    @Override
    public void adjustPower(double power) {
        radiance.adjustPower(power);
    }

    @Override
    public double getPowerFactor() {
        return radiance.getPowerFactor();
    }
}
