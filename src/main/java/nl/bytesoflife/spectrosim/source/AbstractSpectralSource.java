package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.InvalidAttenuationException;
import nl.bytesoflife.spectrosim.PowerNotAdjustableException;
import nl.bytesoflife.spectrosim.axis.AxisKind;
import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;

import java.util.OptionalDouble;

/**
 * Shared bookkeeping for sources: power rating, attenuation and the wavelength/frequency
 * conversions. Subclasses supply the raw per-wavelength density.
 */
public abstract class AbstractSpectralSource implements SpectralSource {

    private final String label;
    private SourceRole role;
    private Double nominalPower;
    private double powerFactor = 1;
    private double attenuation;

    protected AbstractSpectralSource(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Source label must not be blank");
        }
        this.label = label;
    }

    /**
     * Raw density per metre at each wavelength, before power scale and attenuation.
     */
    protected abstract double[] wavelengthDensity(double[] wavelengths);

    /**
     * Raw density per hertz. Defaults to the wavelength density moved across the Jacobian.
     */
    protected double[] frequencyDensity(double[] frequencies) {
        SpectralAxis wl = SpectralAxis.frequency(frequencies).as(AxisKind.WAVELENGTH);
        return SpectralAxis.convertDensity(wavelengthDensity(wl.values()), wl);
    }

    protected double[] rawDensity(SpectralAxis axis) {
        return axis.isWavelength()
                ? wavelengthDensity(axis.values())
                : frequencyDensity(axis.values());
    }

    @Override
    public double[] density(SpectralAxis axis) {
        double f = getPowerFactor() * (1 - getAttenuation());
        double[] raw = rawDensity(axis);
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = f * raw[i];
        }
        return out;
    }

    @Override
    public double[] photonRate(SpectralAxis axis) {
        SpectralAxis nu = axis.as(AxisKind.FREQUENCY);
        double[] densityNu = density(nu);
        double[] out = new double[densityNu.length];
        for (int i = 0; i < out.length; i++) {
            double rate = densityNu[i] / PhysicalConstants.photonEnergy(nu.value(i));
            if (axis.isWavelength()) {
                double wl = axis.value(i);
                rate *= PhysicalConstants.SPEED_OF_LIGHT / (wl * wl);
            }
            out[i] = rate;
        }
        return out;
    }

    @Override
    public OptionalDouble peakFrequency() {
        OptionalDouble wl = peakWavelength();
        return wl.isPresent()
                ? OptionalDouble.of(PhysicalConstants.SPEED_OF_LIGHT / wl.getAsDouble())
                : OptionalDouble.empty();
    }

    /**
     * Axis value at which the effective density is largest.
     */
    public double argmaxDensity(SpectralAxis axis) {
        return axis.value(argmax(density(axis)));
    }

    public double argmaxPhotonRate(SpectralAxis axis) {
        return axis.value(argmax(photonRate(axis)));
    }

    /**
     * Temperature of the blackbody that would peak where this source peaks.
     */
    public double wienTemperature() {
        double wl = peakWavelength().orElseThrow(
                () -> new IllegalStateException("Source '" + label + "' has no defined peak"));
        return PhysicalConstants.WIEN_B / wl;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public SourceRole getRole() {
        return role;
    }

    @Override
    public void setRole(SourceRole role) {
        this.role = role;
    }

    @Override
    public boolean isAdjustable() {
        return nominalPower != null;
    }

    @Override
    public Double getNominalPower() {
        return nominalPower;
    }

    @Override
    public void setNominalPowerRating(double power) {
        if (!(power > 0)) {
            throw new IllegalArgumentException("Nominal power rating must be positive: " + power);
        }
        this.nominalPower = power;
        this.powerFactor = 1;
    }

    @Override
    public void adjustPower(double power) {
        if (nominalPower == null) {
            throw new PowerNotAdjustableException(label);
        }
        this.powerFactor = power / nominalPower;
    }

    @Override
    public double getPowerFactor() {
        return powerFactor;
    }

    @Override
    public double getAttenuation() {
        return attenuation;
    }

    @Override
    public void setAttenuation(double attenuation) {
        if (!(attenuation >= 0 && attenuation <= 1)) {
            throw new InvalidAttenuationException(attenuation);
        }
        this.attenuation = attenuation;
    }

    protected static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + label + "}";
    }
}
