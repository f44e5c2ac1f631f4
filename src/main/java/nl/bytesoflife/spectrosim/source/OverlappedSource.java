package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Sum of several sources of the same kind. Each component contributes its effective density,
 * so per-component attenuation and power still apply. The combined peak is not reported.
 */
public class OverlappedSource extends AbstractSpectralSource {

    private final SpectrumKind kind;
    private final List<SpectralSource> sources = new ArrayList<>();

    public OverlappedSource(String label, SpectrumKind kind) {
        super(label);
        this.kind = kind;
    }

    public static OverlappedSource of(String label, SpectralSource... sources) {
        if (sources.length == 0) {
            throw new IllegalArgumentException("At least one source is needed");
        }
        OverlappedSource sum = new OverlappedSource(label, sources[0].getKind());
        for (SpectralSource source : sources) {
            sum.add(source);
        }
        return sum;
    }

    public OverlappedSource add(SpectralSource source) {
        if (source.getKind() != kind) {
            throw new IllegalArgumentException("Cannot overlap " + source.getKind() + " source '"
                    + source.getLabel() + "' with " + kind + " sources");
        }
        sources.add(source);
        return this;
    }

    public List<SpectralSource> getSources() {
        return Collections.unmodifiableList(sources);
    }

    @Override
    public SpectrumKind getKind() {
        return kind;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        return rawDensity(SpectralAxis.wavelength(wavelengths));
    }

    @Override
    protected double[] rawDensity(SpectralAxis axis) {
        double[] out = new double[axis.size()];
        for (SpectralSource source : sources) {
            double[] d = source.density(axis);
            for (int i = 0; i < out.length; i++) {
                out[i] += d[i];
            }
        }
        return out;
    }

    @Override
    public OptionalDouble peakWavelength() {
        return OptionalDouble.empty();
    }
}
