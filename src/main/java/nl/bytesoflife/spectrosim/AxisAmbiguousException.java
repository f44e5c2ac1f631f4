package nl.bytesoflife.spectrosim;

public class AxisAmbiguousException extends SimulationException {

    public AxisAmbiguousException(String message) {
        super(message);
    }
}
