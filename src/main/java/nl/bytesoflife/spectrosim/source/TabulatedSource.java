package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import nl.bytesoflife.spectrosim.math.LinearInterpolator;
import nl.bytesoflife.spectrosim.math.TabulatedCurve;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Source interpolated from a measured curve. Outside the tabulated range it emits nothing.
 */
public class TabulatedSource extends AbstractSpectralSource {

    private final SpectrumKind kind;
    private final TabulatedCurve curve;
    private final LinearInterpolator interpolator;
    private final double peakWavelength;
    private final double peakFrequency;

    public TabulatedSource(String label, SpectrumKind kind, TabulatedCurve curve) {
        super(label);
        this.kind = kind;
        this.curve = curve;
        this.interpolator = curve.interpolator();

        double[] wl = curve.wavelengths();
        double[] v = curve.values();
        this.peakWavelength = wl[curve.argmax()];

        // The peak moves once the density is expressed per unit frequency
        int best = 0;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < wl.length; i++) {
            double perHz = v[i] * wl[i] * wl[i] / PhysicalConstants.SPEED_OF_LIGHT;
            if (perHz > bestValue) {
                bestValue = perHz;
                best = i;
            }
        }
        this.peakFrequency = PhysicalConstants.SPEED_OF_LIGHT / wl[best];
    }

    public static TabulatedSource radiance(String label, TabulatedCurve curve) {
        return new TabulatedSource(label, SpectrumKind.RADIANCE, curve);
    }

    public static TabulatedSource powerDensity(String label, TabulatedCurve curve) {
        return new TabulatedSource(label, SpectrumKind.POWER_DENSITY, curve);
    }

    @Override
    public SpectrumKind getKind() {
        return kind;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        return interpolator.evaluate(wavelengths);
    }

    @Override
    public OptionalDouble peakWavelength() {
        return OptionalDouble.of(peakWavelength);
    }

    @Override
    public OptionalDouble peakFrequency() {
        return OptionalDouble.of(peakFrequency);
    }

    @Override
    public Optional<double[]> nativeGrid() {
        return Optional.of(curve.wavelengths());
    }
}
