package nl.bytesoflife.spectrosim;

public class NoSourceConfiguredException extends SimulationException {

    public NoSourceConfiguredException() {
        super("No spectral source was bound to the detector");
    }
}
