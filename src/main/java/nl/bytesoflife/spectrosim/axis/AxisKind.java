package nl.bytesoflife.spectrosim.axis;

public enum AxisKind {
    WAVELENGTH,
    FREQUENCY
}
