package nl.bytesoflife.spectrosim;

public class NoSignalException extends SimulationException {

    public NoSignalException() {
        super("Source produced no counts, cannot estimate exposure time");
    }
}
