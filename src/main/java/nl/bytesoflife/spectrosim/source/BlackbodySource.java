package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

import java.util.OptionalDouble;

/**
 * Planck radiance at a fixed temperature.
 */
public class BlackbodySource extends AbstractSpectralSource {

    private double temperature;

    public BlackbodySource(String label, double temperature) {
        super(label);
        setTemperature(temperature);
    }

    public BlackbodySource(double temperature) {
        this("Blackbody " + temperature + " K", temperature);
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        if (!(temperature > 0)) {
            throw new IllegalArgumentException("Blackbody temperature must be positive: " + temperature);
        }
        this.temperature = temperature;
    }

    @Override
    public SpectrumKind getKind() {
        return SpectrumKind.RADIANCE;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        double[] out = new double[wavelengths.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = PhysicalConstants.planckWavelength(wavelengths[i], temperature);
        }
        return out;
    }

    @Override
    protected double[] frequencyDensity(double[] frequencies) {
        double[] out = new double[frequencies.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = PhysicalConstants.planckFrequency(frequencies[i], temperature);
        }
        return out;
    }

    @Override
    public OptionalDouble peakWavelength() {
        return OptionalDouble.of(PhysicalConstants.WIEN_B / temperature);
    }
}
