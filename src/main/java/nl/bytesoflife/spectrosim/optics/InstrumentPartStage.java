package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.math.LinearInterpolator;
import nl.bytesoflife.spectrosim.math.TabulatedCurve;

/**
 * An instrument subsystem made of a number of mirrors and lenses, with a dust layer on
 * their surfaces.
 *
 * <pre>
 * InstrumentPartStage relay = new InstrumentPartStage("Relay", 280)
 *     .withMirrors(4, TabulatedCurve.flat(0.4e-6, 2.6e-6, 0.98))
 *     .withDust(0.0, 0.005);
 * </pre>
 */
public class InstrumentPartStage extends OpticalStage {

    public static final double DEFAULT_DUST_EMISSIVITY = 0.5;
    public static final double DEFAULT_MIRROR_DUST = 0.005;

    /** Band used for flat mirror/lens throughputs; outside it the element is opaque. */
    public static final double FLAT_BAND_MIN = 400e-9;
    public static final double FLAT_BAND_MAX = 2.6e-6;

    private int mirrorCount;
    private int lensCount;
    private LinearInterpolator mirrorThroughput;
    private LinearInterpolator lensThroughput;
    private double lensDust;
    private double mirrorDust = DEFAULT_MIRROR_DUST;
    private double dustEmissivity = DEFAULT_DUST_EMISSIVITY;
    private double areaScaling = 1;

    public InstrumentPartStage(String label, double temperature) {
        super(label, temperature);
    }

    public InstrumentPartStage withMirrors(int count, TabulatedCurve throughput) {
        checkCount(count);
        this.mirrorCount = throughput == null ? 0 : count;
        this.mirrorThroughput = throughput == null ? null : throughput.interpolator();
        return this;
    }

    public InstrumentPartStage withFlatMirrors(int count, double throughput) {
        return withMirrors(count, TabulatedCurve.flat(FLAT_BAND_MIN, FLAT_BAND_MAX, throughput));
    }

    public InstrumentPartStage withLenses(int count, TabulatedCurve throughput) {
        checkCount(count);
        this.lensCount = throughput == null ? 0 : count;
        this.lensThroughput = throughput == null ? null : throughput.interpolator();
        return this;
    }

    public InstrumentPartStage withFlatLenses(int count, double throughput) {
        return withLenses(count, TabulatedCurve.flat(FLAT_BAND_MIN, FLAT_BAND_MAX, throughput));
    }

    public InstrumentPartStage withDust(double lensFraction, double mirrorFraction) {
        this.lensDust = lensFraction;
        this.mirrorDust = mirrorFraction;
        return this;
    }

    public InstrumentPartStage withDustEmissivity(double emissivity) {
        this.dustEmissivity = emissivity;
        return this;
    }

    public InstrumentPartStage withAreaScaling(double scaling) {
        this.areaScaling = scaling;
        return this;
    }

    public int getMirrorCount() {
        return mirrorCount;
    }

    public int getLensCount() {
        return lensCount;
    }

    /**
     * Throughput of the dust layer alone, after area scaling of its emissivity.
     */
    public double getDustThroughput() {
        double mirror = 1. - dustEmissivity * mirrorDust;
        double lens = 1. - dustEmissivity * lensDust;
        double t = Math.pow(mirror, mirrorCount) * Math.pow(lens, lensCount);

        if (areaScaling != 1) {
            t = 1 - (1 - t) * areaScaling;
        }
        return t;
    }

    @Override
    protected double transmittance(double wavelength) {
        double t = getDustThroughput();
        if (mirrorCount > 0) {
            t *= Math.pow(mirrorThroughput.evaluate(wavelength), mirrorCount);
        }
        if (lensCount > 0) {
            t *= Math.pow(lensThroughput.evaluate(wavelength), lensCount);
        }
        return t;
    }

    private static void checkCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Element count must be >= 0: " + count);
        }
    }
}
