package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Arc lamp spectrum: a flat continuum plus thermally broadened Gaussian lines.
 *
 * <p>Each line is a Gaussian whose standard deviation combines the Doppler width of the
 * emitter at the lamp temperature with the coarsest sampling interval of the evaluation grid,
 * so that a line falling between two samples is never lost. Lines further than
 * {@code windowMultiple} hydrogen Doppler widths from the evaluated range are skipped.
 */
public class EmissionLineSource extends AbstractSpectralSource {

    public static final double DEFAULT_WINDOW_MULTIPLE = 6;

    private final double peakFlux;
    private final double temperature;
    private final double continuumFraction;
    private final List<EmissionLine> lines = new ArrayList<>();
    private double windowMultiple = DEFAULT_WINDOW_MULTIPLE;
    private double maxRelativeFlux;
    private double strongestWavelength;

    /**
     * @param peakFlux          integrated flux of the strongest line
     * @param temperature       emitter temperature (K)
     * @param continuumFraction continuum level as a fraction of {@code peakFlux}
     */
    public EmissionLineSource(String label, double peakFlux, double temperature, double continuumFraction) {
        super(label);
        if (!(temperature > 0)) {
            throw new IllegalArgumentException("Lamp temperature must be positive: " + temperature);
        }
        this.peakFlux = peakFlux;
        this.temperature = temperature;
        this.continuumFraction = continuumFraction;
    }

    public EmissionLineSource addLine(EmissionLine line) {
        lines.add(line);
        if (line.relativeFlux() > maxRelativeFlux) {
            maxRelativeFlux = line.relativeFlux();
            strongestWavelength = line.wavelength();
        }
        return this;
    }

    public EmissionLineSource addLineMicrometres(double wavelength, double relativeFlux, double mass) {
        return addLine(new EmissionLine(wavelength * 1e-6, relativeFlux, mass));
    }

    public EmissionLineSource withWindowMultiple(double multiple) {
        this.windowMultiple = multiple;
        return this;
    }

    public List<EmissionLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public double getTemperature() {
        return temperature;
    }

    @Override
    public SpectrumKind getKind() {
        return SpectrumKind.RADIANCE;
    }

    /**
     * Relative Doppler standard deviation of a hydrogen emitter at the lamp temperature.
     */
    public double relativeDopplerWidth() {
        return Math.sqrt(2 * PhysicalConstants.BOLTZMANN * temperature / PhysicalConstants.PROTON_MASS)
                / PhysicalConstants.SPEED_OF_LIGHT;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        double dr = relativeDopplerWidth();
        double minWl = Double.POSITIVE_INFINITY;
        double maxWl = Double.NEGATIVE_INFINITY;
        double sampling = 0;
        for (int i = 0; i < wavelengths.length; i++) {
            minWl = Math.min(minWl, wavelengths[i]);
            maxWl = Math.max(maxWl, wavelengths[i]);
            if (i > 0) {
                sampling = Math.max(sampling, Math.abs(wavelengths[i] - wavelengths[i - 1]));
            }
        }
        double windowMin = minWl * (1 - dr * windowMultiple);
        double windowMax = maxWl * (1 + dr * windowMultiple);

        double[] out = new double[wavelengths.length];
        Arrays.fill(out, continuumFraction * peakFlux);

        if (maxRelativeFlux <= 0) return out;

        double k = peakFlux / (maxRelativeFlux * 4 * Math.PI * Math.sqrt(2 * Math.PI));
        for (EmissionLine line : lines) {
            if (line.wavelength() <= windowMin || line.wavelength() >= windowMax) continue;

            double doppler = dr * line.wavelength() / Math.sqrt(line.mass());
            double sigma = Math.sqrt(doppler * doppler + sampling * sampling);
            double amplitude = line.relativeFlux() * k / sigma;

            for (int i = 0; i < out.length; i++) {
                double z = (wavelengths[i] - line.wavelength()) / sigma;
                out[i] += amplitude * Math.exp(-.5 * z * z);
            }
        }
        return out;
    }

    @Override
    public OptionalDouble peakWavelength() {
        return lines.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(strongestWavelength);
    }
}
