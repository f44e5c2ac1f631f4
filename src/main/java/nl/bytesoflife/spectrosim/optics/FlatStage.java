package nl.bytesoflife.spectrosim.optics;

/**
 * Stage with a wavelength-independent transmittance.
 */
public class FlatStage extends OpticalStage {

    private final double level;

    public FlatStage(String label, double temperature, double level) {
        super(label, temperature);
        if (!(level >= 0 && level <= 1)) {
            throw new IllegalArgumentException("Transmittance must be in [0, 1]: " + level);
        }
        this.level = level;
    }

    public static FlatStage allPass(String label) {
        return new FlatStage(label, 0, 1);
    }

    public double getLevel() {
        return level;
    }

    @Override
    protected double transmittance(double wavelength) {
        return level;
    }
}
