package nl.bytesoflife.spectrosim.source;

import java.util.Map;

public enum SourceRole {
    CALIBRATION,
    SKY;

    private static final Map<String, SourceRole> SHORT_NAMES = Map.of(
            "cal", CALIBRATION,
            "calibration", CALIBRATION,
            "sky", SKY
    );

    public static SourceRole fromName(String name) {
        SourceRole role = SHORT_NAMES.get(name.toLowerCase());
        if (role == null) {
            throw new IllegalArgumentException("Unknown source role: " + name);
        }
        return role;
    }
}
