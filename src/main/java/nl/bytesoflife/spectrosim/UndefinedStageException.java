package nl.bytesoflife.spectrosim;

public class UndefinedStageException extends SimulationException {

    private final String stage;

    public UndefinedStageException(String stage) {
        super("No such stage: " + stage);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
