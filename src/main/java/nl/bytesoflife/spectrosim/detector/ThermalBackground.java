package nl.bytesoflife.spectrosim.detector;

/**
 * Thermal photons reaching the sensor from the cryostat: a radiation cone seeing the cryostat
 * shield and a mechanism cone seeing the (slightly colder) mechanics. Both are integrated over
 * the whole band with Simpson's rule.
 *
 * @param radiationCone        solid angle of the radiation cone (sr)
 * @param mechanismCone        solid angle of the mechanism cone (sr)
 * @param cryostatTemperature  shield temperature (K)
 * @param mechanismTemperature mechanics temperature (K)
 * @param minWavelength        lower integration bound (m)
 * @param maxWavelength        upper integration bound (m)
 * @param samples              odd number of integration points
 */
public record ThermalBackground(
        double radiationCone,
        double mechanismCone,
        double cryostatTemperature,
        double mechanismTemperature,
        double minWavelength,
        double maxWavelength,
        int samples
) {

    public static final double MECHANISM_OFFSET = 5;
    public static final double DEFAULT_MIN_WAVELENGTH = 0.4e-6;
    public static final double DEFAULT_MAX_WAVELENGTH = 2.6e-6;
    public static final int DEFAULT_SAMPLES = 2001;

    public ThermalBackground {
        if (radiationCone < 0 || mechanismCone < 0) {
            throw new IllegalArgumentException("Cone solid angles must be >= 0");
        }
        if (cryostatTemperature < 0 || mechanismTemperature < 0) {
            throw new IllegalArgumentException("Background temperatures must be >= 0 K");
        }
        if (!(maxWavelength > minWavelength) || minWavelength <= 0) {
            throw new IllegalArgumentException("Invalid background band: " + minWavelength + " - " + maxWavelength);
        }
        if (samples < 3 || samples % 2 == 0) {
            throw new IllegalArgumentException("Background samples must be odd and >= 3: " + samples);
        }
    }

    /**
     * Default band and sampling, mechanics {@value #MECHANISM_OFFSET} K below the cryostat.
     */
    public static ThermalBackground of(double radiationCone, double mechanismCone, double cryostatTemperature) {
        return new ThermalBackground(radiationCone, mechanismCone, cryostatTemperature,
                Math.max(0, cryostatTemperature - MECHANISM_OFFSET),
                DEFAULT_MIN_WAVELENGTH, DEFAULT_MAX_WAVELENGTH, DEFAULT_SAMPLES);
    }
}
