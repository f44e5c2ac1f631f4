package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.source.SpectralSource;

public record LampEntry(String name, SpectralSource source, String description) {
}
