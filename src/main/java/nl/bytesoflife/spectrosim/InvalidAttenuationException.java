package nl.bytesoflife.spectrosim;

public class InvalidAttenuationException extends SimulationException {

    private final double attenuation;

    public InvalidAttenuationException(double attenuation) {
        super("Invalid attenuation " + attenuation + " (must be between 0 and 1)");
        this.attenuation = attenuation;
    }

    public double getAttenuation() {
        return attenuation;
    }
}
