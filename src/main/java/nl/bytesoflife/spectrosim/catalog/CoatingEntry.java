package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.optics.OpticalStage;

/**
 * Integrating-sphere wall coating. The stage transmittance is read as the coating's
 * reflectance.
 */
public record CoatingEntry(String name, String description, OpticalStage reflectance) {

    public CoatingEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Coating name must not be blank");
        }
        if (reflectance == null) {
            throw new IllegalArgumentException("Coating '" + name + "' needs a reflectance curve");
        }
    }
}
