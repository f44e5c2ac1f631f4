package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.source.BlackbodySource;
import nl.bytesoflife.spectrosim.source.EmissionLineSource;
import nl.bytesoflife.spectrosim.source.SourceRole;

import java.util.List;

/**
 * Factory for the built-in calibration lamps.
 *
 * <p>Arc lamp fluxes follow typical Oriel calibration lamps, which peak at about
 * 10 µW / (cm² nm) = 1e8 W / (m² m). Line widths are set to 1 nm until a better figure is
 * known. Lamps carry mutable power and attenuation, so every call returns fresh instances.
 */
public class BuiltinLamps {

    public static final double PEAK_FLUX_DENSITY = 1e8;   // W / (m² m)
    public static final double LINE_WIDTH = 1e-9;         // m
    public static final double PEAK_FLUX = PEAK_FLUX_DENSITY * LINE_WIDTH;
    public static final double CONTINUUM_FRACTION = 0.1;
    public static final double ARC_TEMPERATURE = 1000;
    public static final double PLANCK_TEMPERATURE = 5700;

    // wavelength (µm), relative flux
    private static final double[][] ARGON_LINES = {
            {0.472819, 23442},
            {0.473723, 1000},
            {0.476620, 2344},
            {0.480736, 1820},
            {0.488123, 2239},
            {0.611662, 537},
            {0.617399, 407},
            {0.664553, 269},
            {0.763721, 25000},
            {0.795036, 20000},
            {0.801699, 25000},
            {0.810592, 20000},
            {0.811754, 35000},
            {0.826679, 10000},
            {0.841052, 15000},
            {0.842696, 20000},
            {0.852378, 15000},
            {0.912547, 35000},
            {1.067649, 200},
            {1.167190, 200},
            {1.211564, 200},
            {1.214306, 50},
            {1.234677, 50},
            {1.240622, 200},
            {1.244272, 200},
            {1.245953, 100},
            {1.249108, 200},
            {1.270576, 150},
            {1.280624, 200},
            {1.293673, 50},
            {1.296020, 500},
            {1.301182, 200},
            {1.323452, 100},
            {1.327627, 500},
            {1.331685, 1000},
            {1.350788, 1000},
            {1.360305, 30},
            {1.362638, 400},
            {1.368229, 200},
            {1.382950, 10},
            {1.409749, 200},
            {1.505061, 100},
            {1.599386, 30},
            {1.694521, 500}
    };

    private static final double[][] MERCURY_LINES = {
            {0.546227, 6000},
            {0.577121, 1000},
            {0.579228, 900},
            {1.014253, 1600},
            {1.129020, 1000},
            {1.213180, 5},
            {1.321356, 400},
            {1.343024, 400},
            {1.347206, 130},
            {1.350927, 200},
            {1.357392, 200},
            {1.367725, 300},
            {1.395436, 200},
            {1.530000, 600}
    };

    private static final double[][] KRYPTON_LINES = {
            {0.760364, 27320000},
            {0.785698, 20410000},
            {0.793078, 7700000},
            {0.806172, 15830000},
            {0.810625, 6520000},
            {0.810659, 8960000},
            {0.811513, 36100000},
            {0.819231, 8940000},
            {0.826551, 34160000},
            {0.828333, 14180000},
            {0.830039, 29310000},
            {0.851121, 18110000},
            {0.877916, 22170000},
            {0.893114, 22890000},
            {1.182261, 8110000},
            {1.318101, 4900000},
            {1.324431, 3180000},
            {1.362614, 4970000},
            {1.363795, 10300000},
            {1.383666, 3120000},
            {1.388665, 10600000},
            {1.394281, 11000000},
            {1.443074, 9300000},
            {1.473847, 2810000},
            {1.524379, 3960000},
            {1.537624, 1470000},
            {1.678972, 6760000},
            {1.685810, 1300000},
            {1.689507, 7680000},
            {1.694044, 5770000}
    };

    private static final double[][] NEON_LINES = {
            {0.609785, 3000},
            {0.614476, 10000},
            {0.633618, 10000},
            {0.638476, 10000},
            {0.640402, 20000},
            {0.650833, 15000},
            {0.668012, 5000},
            {0.693138, 100000},
            {0.703435, 85000},
            {0.749093, 32000},
            {0.753785, 28000},
            {0.813864, 17000},
            {0.830261, 29000},
            {0.837991, 76000},
            {0.842074, 26000},
            {0.849769, 69000},
            {0.859362, 41000},
            {0.863702, 35000},
            {0.865676, 64000},
            {0.868188, 13000},
            {0.868431, 15000},
            {0.877407, 10000},
            {0.878303, 57000},
            {0.878617, 43000},
            {0.885630, 27000},
            {0.886819, 15000},
            {0.915118, 12000},
            {1.056530, 8000},
            {1.114607, 26000},
            {1.118059, 49000},
            {1.152590, 33000},
            {1.152818, 17000},
            {1.153950, 9100},
            {1.177001, 15000},
            {1.206964, 23000},
            {1.499041, 530},
            {1.507829, 140},
            {1.514424, 350},
            {1.519508, 270},
            {1.535238, 160},
            {1.541180, 250},
            {2.104701, 2700},
            {2.171404, 2900},
            {2.225343, 1300},
            {2.243426, 1300},
            {2.247292, 540},
            {2.253653, 8500},
            {2.266797, 1300},
            {2.269396, 210},
            {2.310678, 2500},
            {2.326662, 3800},
            {2.337934, 5000},
            {2.357176, 3400},
            {2.364293, 17000},
            {2.370813, 1200},
            {2.371560, 5900},
            {2.391854, 170},
            {2.395793, 11000},
            {2.396296, 4600},
            {2.397837, 220},
            {2.398470, 6000},
            {2.409353, 200},
            {2.410515, 1100},
            {2.415649, 210},
            {2.416802, 2000},
            {2.425622, 2800},
            {2.437166, 7400},
            {2.437826, 3800},
            {2.439001, 360},
            {2.445453, 1900},
            {2.445978, 240},
            {2.446607, 3300},
            {2.447161, 370}
    };

    private static final double[][] XENON_LINES = {
            {0.712156, 500},
            {0.764413, 500},
            {0.820859, 700},
            {0.826879, 500},
            {0.828239, 7000},
            {0.834912, 2000},
            {0.882183, 5000},
            {0.893328, 200},
            {0.895471, 1000},
            {0.904793, 400},
            {0.916517, 500},
            {0.980238, 2000},
            {0.992592, 3000},
            {1.262685, 5},
            {1.366021, 150},
            {1.414596, 80},
            {1.473641, 200},
            {1.542222, 110},
            {1.605641, 50},
            {1.673273, 5000},
            {2.026777, 2300}
    };

    public static EmissionLineSource argon() {
        return arcLamp("Ar", 40, ARGON_LINES);
    }

    public static EmissionLineSource mercury() {
        return arcLamp("Hg", 200.59, MERCURY_LINES);
    }

    public static EmissionLineSource krypton() {
        return arcLamp("Kr", 83.8, KRYPTON_LINES);
    }

    public static EmissionLineSource neon() {
        return arcLamp("Ne", 20.18, NEON_LINES);
    }

    public static EmissionLineSource xenon() {
        return arcLamp("Xe", 131.3, XENON_LINES);
    }

    /**
     * Ideal black body at {@value #PLANCK_TEMPERATURE} K.
     */
    public static BlackbodySource planck() {
        BlackbodySource lamp = new BlackbodySource("PLANK", PLANCK_TEMPERATURE);
        lamp.setRole(SourceRole.CALIBRATION);
        return lamp;
    }

    public static List<LampEntry> all() {
        return List.of(
                new LampEntry("PLANK", planck(), "Theoretical black body emission at 5700 K"),
                new LampEntry("Hg", mercury(), "Mercury arc lamp"),
                new LampEntry("Ne", neon(), "Neon arc lamp"),
                new LampEntry("Ar", argon(), "Argon arc lamp"),
                new LampEntry("Kr", krypton(), "Krypton arc lamp"),
                new LampEntry("Xe", xenon(), "Xenon arc lamp")
        );
    }

    private static EmissionLineSource arcLamp(String name, double mass, double[][] lines) {
        EmissionLineSource lamp = new EmissionLineSource(name, PEAK_FLUX, ARC_TEMPERATURE, CONTINUUM_FRACTION);
        for (double[] line : lines) {
            lamp.addLineMicrometres(line[0], line[1], mass);
        }
        lamp.setRole(SourceRole.CALIBRATION);
        return lamp;
    }
}
