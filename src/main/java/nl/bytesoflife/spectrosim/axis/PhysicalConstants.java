package nl.bytesoflife.spectrosim.axis;

/**
 * SI constants used across the radiometric chain.
 */
public final class PhysicalConstants {

    public static final double SPEED_OF_LIGHT = 299792458.0;     // m / s
    public static final double PLANCK_CONSTANT = 6.62607015e-34; // J s
    public static final double BOLTZMANN = 1.380649e-23;         // J / K
    public static final double WIEN_B = 2.897771955e-3;          // m K
    public static final double PROTON_MASS = 1.6726219e-27;      // kg

    private PhysicalConstants() {
    }

    /**
     * Energy of a single photon of the given frequency (J).
     */
    public static double photonEnergy(double frequency) {
        return PLANCK_CONSTANT * frequency;
    }

    /**
     * Planck spectral radiance per unit wavelength, W / (m² sr m).
     */
    public static double planckWavelength(double wavelength, double temperature) {
        if (temperature <= 0 || wavelength <= 0) return 0;
        double c2 = SPEED_OF_LIGHT * SPEED_OF_LIGHT;
        double x = PLANCK_CONSTANT * SPEED_OF_LIGHT / (wavelength * BOLTZMANN * temperature);
        return 2 * PLANCK_CONSTANT * c2 / Math.pow(wavelength, 5) / Math.expm1(x);
    }

    /**
     * Planck spectral radiance per unit frequency, W / (m² sr Hz).
     */
    public static double planckFrequency(double frequency, double temperature) {
        if (temperature <= 0 || frequency <= 0) return 0;
        double c2 = SPEED_OF_LIGHT * SPEED_OF_LIGHT;
        double x = PLANCK_CONSTANT * frequency / (BOLTZMANN * temperature);
        return 2 * PLANCK_CONSTANT * frequency * frequency * frequency / (c2 * Math.expm1(x));
    }
}
