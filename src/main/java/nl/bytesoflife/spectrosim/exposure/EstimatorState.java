package nl.bytesoflife.spectrosim.exposure;

public enum EstimatorState {
    INITIALIZED,
    WORKING,
    DONE
}
