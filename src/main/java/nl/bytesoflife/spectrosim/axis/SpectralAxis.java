package nl.bytesoflife.spectrosim.axis;

import nl.bytesoflife.spectrosim.AxisAmbiguousException;

import java.util.Arrays;

/**
 * A sequence of spectral coordinates tagged with their kind. Wavelengths are in
 * metres, frequencies in hertz. A scalar evaluation is a length-1 axis.
 */
public final class SpectralAxis {

    private final AxisKind kind;
    private final double[] values;

    private SpectralAxis(AxisKind kind, double[] values) {
        if (values == null || values.length == 0) {
            throw new AxisAmbiguousException("Spectral axis must contain at least one value");
        }
        this.kind = kind;
        this.values = values.clone();
    }

    public static SpectralAxis wavelength(double... wavelengths) {
        return new SpectralAxis(AxisKind.WAVELENGTH, wavelengths);
    }

    public static SpectralAxis frequency(double... frequencies) {
        return new SpectralAxis(AxisKind.FREQUENCY, frequencies);
    }

    /**
     * Builds an axis from a pair of optional arguments, exactly one of which must be present.
     */
    public static SpectralAxis of(double[] wavelengths, double[] frequencies) {
        if (wavelengths != null && frequencies != null) {
            throw new AxisAmbiguousException("Both wavelength and frequency were provided");
        }
        if (wavelengths == null && frequencies == null) {
            throw new AxisAmbiguousException("Either wavelength or frequency must be provided");
        }
        return wavelengths != null ? wavelength(wavelengths) : frequency(frequencies);
    }

    /**
     * Uniformly spaced wavelength axis from {@code min} to {@code max}, both included.
     */
    public static SpectralAxis wavelengthRange(double min, double max, int count) {
        if (count < 2) {
            throw new IllegalArgumentException("A range needs at least 2 samples");
        }
        double[] wl = new double[count];
        double step = (max - min) / (count - 1);
        for (int i = 0; i < count; i++) {
            wl[i] = min + i * step;
        }
        wl[count - 1] = max;
        return new SpectralAxis(AxisKind.WAVELENGTH, wl);
    }

    public AxisKind kind() {
        return kind;
    }

    public boolean isWavelength() {
        return kind == AxisKind.WAVELENGTH;
    }

    public int size() {
        return values.length;
    }

    public double value(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Same physical points expressed as wavelengths (m).
     */
    public double[] wavelengths() {
        return isWavelength() ? values.clone() : convertPoints(values);
    }

    /**
     * Same physical points expressed as frequencies (Hz).
     */
    public double[] frequencies() {
        return isWavelength() ? convertPoints(values) : values.clone();
    }

    public SpectralAxis as(AxisKind target) {
        if (target == kind) return this;
        return new SpectralAxis(target, convertPoints(values));
    }

    public SpectralAxis subset(int index) {
        return new SpectralAxis(kind, new double[]{values[index]});
    }

    /**
     * Converts a spectral density sampled at {@code axisValue} into the density per unit of the other axis kind at the same physical point.
     * A per-wavelength density becomes per-frequency by multiplying with |dλ/dν| = c/ν², and
     * the reverse uses |dν/dλ| = c/λ².
     */
    public static double convertDensity(double density, double axisValue) {
        return density * jacobian(axisValue);
    }

    public static double[] convertDensity(double[] densities, SpectralAxis axis) {
        double[] out = new double[densities.length];
        for (int i = 0; i < densities.length; i++) {
            out[i] = convertDensity(densities[i], axis.values[i]);
        }
        return out;
    }

    // c / x² evaluated at the point conjugate to axisValue
    private static double jacobian(double axisValue) {
        double conjugate = PhysicalConstants.SPEED_OF_LIGHT / axisValue;
        return PhysicalConstants.SPEED_OF_LIGHT / (conjugate * conjugate);
    }

    private static double[] convertPoints(double[] points) {
        double[] out = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            out[i] = PhysicalConstants.SPEED_OF_LIGHT / points[i];
        }
        return out;
    }

    @Override
    public String toString() {
        return "SpectralAxis{" + kind + ", n=" + values.length
                + (values.length <= 4 ? ", values=" + Arrays.toString(values) : "") + "}";
    }
}
