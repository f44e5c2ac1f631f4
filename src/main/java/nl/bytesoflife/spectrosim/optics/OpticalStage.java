package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.ShapeMismatchException;
import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

/**
 * A single element of the optical train with its own temperature. Lossy stages re-radiate
 * as a graybody: whatever fraction of a radiance spectrum they do not transmit is replaced
 * by blackbody radiance at the stage temperature.
 */
public abstract class OpticalStage implements OpticalElement {

    private final String label;
    private double temperature;
    private double multiplicity = 1;
    private boolean backgroundEmission = true;

    protected OpticalStage(String label, double temperature) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Stage label must not be blank");
        }
        this.label = label;
        setTemperature(temperature);
    }

    /**
     * Single-pass transmittance of the element at the given wavelength (m), in [0, 1].
     */
    protected abstract double transmittance(double wavelength);

    @Override
    public String getLabel() {
        return label;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        if (!(temperature >= 0)) {
            throw new IllegalArgumentException("Stage temperature must be >= 0 K: " + temperature);
        }
        this.temperature = temperature;
    }

    @Override
    public double getMultiplicity() {
        return multiplicity;
    }

    @Override
    public void setMultiplicity(double multiplicity) {
        OpticalElement.roundMultiplicity(multiplicity);
        this.multiplicity = multiplicity;
    }

    public boolean isBackgroundEmission() {
        return backgroundEmission;
    }

    public OpticalStage withBackgroundEmission(boolean enabled) {
        this.backgroundEmission = enabled;
        return this;
    }

    public double getT(double wavelength) {
        return Math.pow(clamp(transmittance(wavelength)), getRepeatCount());
    }

    @Override
    public double[] getT(SpectralAxis axis) {
        double[] wl = axis.wavelengths();
        double[] t = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            t[i] = getT(wl[i]);
        }
        return t;
    }

    @Override
    public double[] apply(SpectralAxis axis, double[] density, SpectrumKind kind) {
        if (density.length != axis.size()) {
            throw new ShapeMismatchException(axis.size(), density.length);
        }
        double[] t = getT(axis);
        double[] out = new double[density.length];
        boolean emit = emits(kind);

        for (int i = 0; i < out.length; i++) {
            out[i] = t[i] * density[i];
            if (emit) {
                // n passes of x -> t x + (1 - t) B collapse to t^n x + (1 - t^n) B
                out[i] += (1 - t[i]) * graybody(axis, i);
            }
        }
        return out;
    }

    /**
     * Integrated output of this stage for a unit-area Gaussian line centred at {@code center}.
     */
    public double estimateResponse(double center, double fwhm, int samples) {
        double std = fwhm / 2.355;
        SpectralAxis axis = SpectralAxis.wavelengthRange(center - 5 * std, center + 5 * std, samples);
        double dw = axis.value(1) - axis.value(0);
        double sum = 0;
        for (int i = 0; i < axis.size(); i++) {
            double line = Math.exp(-.5 * Math.pow((axis.value(i) - center) / std, 2)) / (std * Math.sqrt(2 * Math.PI));
            sum += getT(axis.value(i)) * line;
        }
        return sum * dw;
    }

    private boolean emits(SpectrumKind kind) {
        return backgroundEmission && kind == SpectrumKind.RADIANCE && temperature > 0 && getRepeatCount() > 0;
    }

    private double graybody(SpectralAxis axis, int i) {
        return axis.isWavelength()
                ? PhysicalConstants.planckWavelength(axis.value(i), temperature)
                : PhysicalConstants.planckFrequency(axis.value(i), temperature);
    }

    private static double clamp(double t) {
        if (Double.isNaN(t) || t < 0) return 0;
        return Math.min(t, 1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + label + ", T=" + temperature + "K, x" + getRepeatCount() + "}";
    }
}
