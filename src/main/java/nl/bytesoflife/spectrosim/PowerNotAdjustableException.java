package nl.bytesoflife.spectrosim;

public class PowerNotAdjustableException extends SimulationException {

    public PowerNotAdjustableException(String sourceLabel) {
        super("Cannot adjust power of source '" + sourceLabel + "': no nominal power rating set");
    }
}
