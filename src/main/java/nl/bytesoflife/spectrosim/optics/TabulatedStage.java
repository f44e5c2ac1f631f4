package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.math.LinearInterpolator;
import nl.bytesoflife.spectrosim.math.TabulatedCurve;

/**
 * Stage driven by a tabulated throughput curve. Outside the tabulated band the stage is opaque.
 */
public class TabulatedStage extends OpticalStage {

    private final TabulatedCurve curve;
    private final LinearInterpolator interpolator;

    public TabulatedStage(String label, double temperature, TabulatedCurve throughput) {
        super(label, temperature);
        this.curve = throughput;
        this.interpolator = throughput.interpolator();
    }

    public static TabulatedStage fromThroughput(String label, double temperature, TabulatedCurve throughput) {
        return new TabulatedStage(label, temperature, throughput);
    }

    /**
     * Builds a stage from an emissivity table; the throughput is 1 - emissivity.
     */
    public static TabulatedStage fromEmissivity(String label, double temperature, TabulatedCurve emissivity) {
        return new TabulatedStage(label, temperature, emissivity.complement());
    }

    public TabulatedCurve getCurve() {
        return curve;
    }

    @Override
    protected double transmittance(double wavelength) {
        return interpolator.evaluate(wavelength);
    }
}
