package nl.bytesoflife.spectrosim;

public class UndefinedGratingException extends SimulationException {

    private final String grating;

    public UndefinedGratingException(String grating) {
        super("Undefined grating: " + grating);
        this.grating = grating;
    }

    public String getGrating() {
        return grating;
    }
}
