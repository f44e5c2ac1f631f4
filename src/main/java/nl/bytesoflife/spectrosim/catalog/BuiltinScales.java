package nl.bytesoflife.spectrosim.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HARMONI spaxel scales and the integrating-sphere coatings offered for the calibration
 * module. Coating reflectance curves are loaded elsewhere; only names and descriptions live
 * here.
 */
public class BuiltinScales {

    /** Finest HARMONI spaxel (mas). */
    public static final double FINEST_SPAXEL_SIZE = 4.14;

    private static volatile List<SpaxelScale> cachedHarmoni;

    public static List<SpaxelScale> harmoni() {
        if (cachedHarmoni == null) {
            synchronized (BuiltinScales.class) {
                if (cachedHarmoni == null) {
                    cachedHarmoni = List.of(
                            new SpaxelScale(4, 4, FINEST_SPAXEL_SIZE, FINEST_SPAXEL_SIZE),
                            new SpaxelScale(10, 10, 10, 10),
                            new SpaxelScale(20, 20, 20, 20),
                            new SpaxelScale(60, 30, 60, 30)
                    );
                }
            }
        }
        return cachedHarmoni;
    }

    /**
     * Coating name to description, in display order.
     */
    public static Map<String, String> coatingDescriptions() {
        Map<String, String> coatings = new LinkedHashMap<>();
        coatings.put("SPECTRALON", "LabSphere's Spectralon®");
        coatings.put("SPECTRAFLECT", "LabSphere's Spectraflect®");
        coatings.put("DIFFGOLD", "LabSphere's Infragold®");
        return coatings;
    }
}
