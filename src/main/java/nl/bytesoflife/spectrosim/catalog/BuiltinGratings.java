package nl.bytesoflife.spectrosim.catalog;

import java.util.List;

/**
 * Factory for the HARMONI grating set.
 * <ul>
 *   <li>VIS: R = 3000, 0.462 - 0.812 µm</li>
 *   <li>LR1-2: R = 3327, IZJ and HK bands</li>
 *   <li>MR1-4: R = 7050, IZ, J, H and K bands</li>
 *   <li>HR1-4: R = 18000, Z, H (high), K (short) and K (long) bands</li>
 * </ul>
 */
public class BuiltinGratings {

    private static volatile List<Grating> cachedHarmoni;

    public static List<Grating> harmoni() {
        if (cachedHarmoni == null) {
            synchronized (BuiltinGratings.class) {
                if (cachedHarmoni == null) {
                    cachedHarmoni = createHarmoni();
                }
            }
        }
        return cachedHarmoni;
    }

    /**
     * Names of the passband filters the HARMONI gratings refer to.
     */
    public static List<String> filterNames() {
        return List.of("H (high)", "H", "HK", "IZ", "IZJ", "J", "K", "K (long)", "K (short)", "VIS", "Z");
    }

    public static List<String> equalizerNames() {
        return List.of("VIS", "LR1", "LR2", "MR1", "MR2", "MR3", "MR4", "HR1", "HR2", "HR3", "HR4");
    }

    private static List<Grating> createHarmoni() {
        return List.of(
                new Grating("VIS", "VIS", "VIS", 3000, 0.462e-6, 0.812e-6),

                new Grating("LR1", "IZJ", "LR1", 3327, 0.811e-6, 1.369e-6),
                new Grating("LR2", "HK", "LR2", 3327, 1.450e-6, 2.450e-6),

                new Grating("MR1", "IZ", "MR1", 7050, 0.830e-6, 1.050e-6),
                new Grating("MR2", "J", "MR2", 7050, 1.046e-6, 1.324e-6),
                new Grating("MR3", "H", "MR3", 7050, 1.435e-6, 1.815e-6),
                new Grating("MR4", "K", "MR4", 7050, 1.951e-6, 2.469e-6),

                new Grating("HR1", "Z", "HR1", 18000, 0.827e-6, 0.903e-6),
                new Grating("HR2", "H (high)", "HR2", 18000, 1.538e-6, 1.678e-6),
                new Grating("HR3", "K (short)", "HR3", 18000, 2.017e-6, 2.201e-6),
                new Grating("HR4", "K (long)", "HR4", 18000, 2.199e-6, 2.399e-6)
        );
    }
}
