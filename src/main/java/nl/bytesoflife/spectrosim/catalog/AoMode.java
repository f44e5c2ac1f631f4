package nl.bytesoflife.spectrosim.catalog;

import java.util.Map;

/**
 * Adaptive optics configuration in front of the instrument. Each AO mode other than
 * {@link #NOAO} adds its dichroic to the optical train.
 */
public enum AoMode {
    NOAO(null),
    SCAO(InstrumentCatalog.SCAO_DICHROIC),
    LTAO(InstrumentCatalog.LTAO_DICHROIC);

    private static final Map<String, AoMode> NAMES = Map.of(
            "noao", NOAO,
            "scao", SCAO,
            "ltao", LTAO
    );

    private final String dichroicStage;

    AoMode(String dichroicStage) {
        this.dichroicStage = dichroicStage;
    }

    /** Stage name of the dichroic, or null when the mode has none. */
    public String getDichroicStage() {
        return dichroicStage;
    }

    public static AoMode fromName(String name) {
        AoMode mode = NAMES.get(name.toLowerCase());
        if (mode == null) {
            throw new IllegalArgumentException("Undefined AO configuration: " + name);
        }
        return mode;
    }
}
