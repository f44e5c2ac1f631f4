package nl.bytesoflife.spectrosim.math;

/**
 * A sampled curve as supplied by a catalog: strictly increasing wavelengths in metres
 * and one value per wavelength.
 *
 * @param wavelengths axis samples (m)
 * @param values      curve value at each sample
 */
public record TabulatedCurve(double[] wavelengths, double[] values) {

    public TabulatedCurve {
        if (wavelengths == null || values == null) {
            throw new IllegalArgumentException("Curve columns must not be null");
        }
        if (wavelengths.length != values.length) {
            throw new IllegalArgumentException("Curve columns differ in length: "
                    + wavelengths.length + " vs " + values.length);
        }
        wavelengths = wavelengths.clone();
        values = values.clone();
    }

    /**
     * Builds a curve whose axis is given in micrometres, scaling values by {@code valueScale}
     * (e.g. 1e6 to turn a W/µm density into W/m).
     */
    public static TabulatedCurve fromMicrometres(double[] micrometres, double[] values, double valueScale) {
        double[] wl = new double[micrometres.length];
        double[] v = new double[values.length];
        for (int i = 0; i < wl.length; i++) {
            wl[i] = micrometres[i] * 1e-6;
        }
        for (int i = 0; i < v.length; i++) {
            v[i] = values[i] * valueScale;
        }
        return new TabulatedCurve(wl, v);
    }

    public static TabulatedCurve flat(double minWavelength, double maxWavelength, double level) {
        return new TabulatedCurve(new double[]{minWavelength, maxWavelength}, new double[]{level, level});
    }

    /**
     * The curve 1 - v, used to turn emissivity tables into throughput tables.
     */
    public TabulatedCurve complement() {
        double[] v = new double[values.length];
        for (int i = 0; i < v.length; i++) {
            v[i] = 1.0 - values[i];
        }
        return new TabulatedCurve(wavelengths, v);
    }

    public int size() {
        return wavelengths.length;
    }

    public LinearInterpolator interpolator() {
        return new LinearInterpolator(wavelengths, values, 0.0);
    }

    /**
     * Index of the largest value.
     */
    public int argmax() {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
