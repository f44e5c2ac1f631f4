package nl.bytesoflife.spectrosim.optics;

import java.util.Arrays;

/**
 * Atmospheric transmission tabulated against wavelength and airmass. Wavelengths outside the
 * table are extrapolated linearly from the two edge rows. Airmasses outside the table are
 * clamped to its edges and the result is scaled by the ratio of the requested to the clamped
 * airmass. The sky emits nothing through this stage; sky emission is modelled as
 * a source.
 */
public class SkyStage extends OpticalStage {

    private final double[] wavelengths;
    private final double[] airmasses;
    private final double[][] table;
    private double airmass;
    private double scale = 1;

    /**
     * @param wavelengths increasing wavelength samples (m)
     * @param airmasses   increasing airmass samples
     * @param table       transmission, indexed {@code [wavelength][airmass]}
     */
    public SkyStage(String label, double[] wavelengths, double[] airmasses, double[][] table) {
        super(label, 0);
        if (airmasses.length == 0) {
            throw new IllegalArgumentException("Airmass list must not be empty");
        }
        if (table.length != wavelengths.length) {
            throw new IllegalArgumentException("Sky table has " + table.length
                    + " rows, expected " + wavelengths.length);
        }
        for (double[] row : table) {
            if (row.length != airmasses.length) {
                throw new IllegalArgumentException("Number of sky table columns does not match airmass count");
            }
        }
        this.wavelengths = wavelengths.clone();
        this.airmasses = airmasses.clone();
        this.table = new double[table.length][];
        for (int i = 0; i < table.length; i++) {
            this.table[i] = table[i].clone();
        }
        this.airmass = airmasses[0];
        withBackgroundEmission(false);
    }

    public void setAirmass(double requested) {
        double clamped = Math.max(airmasses[0], Math.min(requested, airmasses[airmasses.length - 1]));
        this.airmass = clamped;
        this.scale = requested / clamped;
    }

    public double getAirmass() {
        return airmass;
    }

    @Override
    protected double transmittance(double wavelength) {
        return scale * bilinear(wavelength, airmass);
    }

    private double bilinear(double wl, double am) {
        int[] wi = bracket(wavelengths, wl, true);
        int[] ai = bracket(airmasses, am, false);
        double fw = fraction(wavelengths, wi, wl);
        double fa = fraction(airmasses, ai, am);

        double low = lerp(table[wi[0]][ai[0]], table[wi[0]][ai[1]], fa);
        double high = lerp(table[wi[1]][ai[0]], table[wi[1]][ai[1]], fa);
        return lerp(low, high, fw);
    }

    /**
     * Indices of the table rows around {@code v}. Outside the table the edge pair is returned
     * when {@code extrapolate} is set, otherwise the edge row alone.
     */
    private static int[] bracket(double[] axis, double v, boolean extrapolate) {
        int last = axis.length - 1;
        if (axis.length == 1) return new int[]{0, 0};
        if (v <= axis[0]) return extrapolate ? new int[]{0, 1} : new int[]{0, 0};
        if (v >= axis[last]) return extrapolate ? new int[]{last - 1, last} : new int[]{last, last};
        int idx = Arrays.binarySearch(axis, v);
        if (idx >= 0) return new int[]{idx, idx};
        int hi = -idx - 1;
        return new int[]{hi - 1, hi};
    }

    private static double fraction(double[] axis, int[] idx, double v) {
        if (idx[0] == idx[1]) return 0;
        return (v - axis[idx[0]]) / (axis[idx[1]] - axis[idx[0]]);
    }

    private static double lerp(double a, double b, double f) {
        return a + f * (b - a);
    }
}
