package nl.bytesoflife.spectrosim;

public class ShapeMismatchException extends SimulationException {

    private final int expected;
    private final int actual;

    public ShapeMismatchException(int expected, int actual) {
        super("Axis and spectrum size mismatch: expected " + expected + " samples, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
