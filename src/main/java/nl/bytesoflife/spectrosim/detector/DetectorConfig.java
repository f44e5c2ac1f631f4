package nl.bytesoflife.spectrosim.detector;

import nl.bytesoflife.spectrosim.optics.FlatStage;
import nl.bytesoflife.spectrosim.optics.OpticalStage;

/**
 * Geometry and electronics of a detector pixel. Defaults describe a NIR HARMONI detector.
 */
public class DetectorConfig {

    public static final double DEFAULT_PIXEL_SIZE = 13.3e-6;
    public static final double DEFAULT_RESOLVING_POWER = 3000;
    public static final double DEFAULT_PX_PER_RES_ELEMENT = 2.2;
    public static final double DEFAULT_QE = 0.95;
    public static final double DEFAULT_GAIN = 1;
    public static final double DEFAULT_READ_NOISE = 5;
    public static final double DEFAULT_F_NUMBER = 17.37;

    private double pixelSize = DEFAULT_PIXEL_SIZE;
    private double resolvingPower = DEFAULT_RESOLVING_POWER;
    private double pxPerResElement = DEFAULT_PX_PER_RES_ELEMENT;
    private double binning = 1;
    private OpticalStage quantumEfficiency = qeStage(DEFAULT_QE);
    private double gain = DEFAULT_GAIN;
    private ReadNoise readNoise = ReadNoise.constant(DEFAULT_READ_NOISE);
    private double fNumber = DEFAULT_F_NUMBER;
    private ThermalBackground thermalBackground;

    public DetectorConfig withPixelSize(double pixelSize) {
        if (!(pixelSize > 0)) {
            throw new IllegalArgumentException("Pixel size must be positive: " + pixelSize);
        }
        this.pixelSize = pixelSize;
        return this;
    }

    public DetectorConfig withResolvingPower(double resolvingPower) {
        if (!(resolvingPower > 0)) {
            throw new IllegalArgumentException("Resolving power must be positive: " + resolvingPower);
        }
        this.resolvingPower = resolvingPower;
        return this;
    }

    public DetectorConfig withPxPerResElement(double pxPerResElement) {
        if (!(pxPerResElement > 0)) {
            throw new IllegalArgumentException("Pixels per resolution element must be positive");
        }
        this.pxPerResElement = pxPerResElement;
        return this;
    }

    public DetectorConfig withBinning(double binning) {
        if (!(binning > 0)) {
            throw new IllegalArgumentException("Binning must be positive: " + binning);
        }
        this.binning = binning;
        return this;
    }

    public DetectorConfig withQuantumEfficiency(double qe) {
        this.quantumEfficiency = qeStage(qe);
        return this;
    }

    /**
     * Wavelength-dependent QE, read from the stage transmittance.
     */
    public DetectorConfig withQuantumEfficiency(OpticalStage qe) {
        this.quantumEfficiency = qe;
        return this;
    }

    public DetectorConfig withGain(double gain) {
        if (!(gain > 0)) {
            throw new IllegalArgumentException("Gain must be positive: " + gain);
        }
        this.gain = gain;
        return this;
    }

    public DetectorConfig withReadNoise(ReadNoise readNoise) {
        this.readNoise = readNoise;
        return this;
    }

    public DetectorConfig withFNumber(double fNumber) {
        if (!(fNumber > 0)) {
            throw new IllegalArgumentException("f-number must be positive: " + fNumber);
        }
        this.fNumber = fNumber;
        return this;
    }

    public DetectorConfig withThermalBackground(ThermalBackground thermalBackground) {
        this.thermalBackground = thermalBackground;
        return this;
    }

    public double getPixelSize() {
        return pixelSize;
    }

    public double getPixelArea() {
        return pixelSize * pixelSize;
    }

    public double getResolvingPower() {
        return resolvingPower;
    }

    public double getPxPerResElement() {
        return pxPerResElement;
    }

    public double getBinning() {
        return binning;
    }

    public OpticalStage getQuantumEfficiency() {
        return quantumEfficiency;
    }

    public double getGain() {
        return gain;
    }

    public ReadNoise getReadNoise() {
        return readNoise;
    }

    public double getFNumber() {
        return fNumber;
    }

    /** May be null: no thermal background. */
    public ThermalBackground getThermalBackground() {
        return thermalBackground;
    }

    private static OpticalStage qeStage(double qe) {
        return new FlatStage("QE", 0, qe).withBackgroundEmission(false);
    }
}
