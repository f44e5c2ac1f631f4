package nl.bytesoflife.spectrosim;

/**
 * Base class for configuration and usage errors raised by the simulation core.
 * These are surfaced synchronously to the caller and never retried.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }
}
