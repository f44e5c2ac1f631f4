package nl.bytesoflife.spectrosim.axis;

/**
 * Physical nature of a spectral density. Only radiance spectra pick up graybody emission
 * from the optics they cross.
 */
public enum SpectrumKind {
    /** W / (m² sr m) per wavelength, W / (m² sr Hz) per frequency. */
    RADIANCE,
    /** W / m per wavelength, W / Hz per frequency. */
    POWER_DENSITY
}
