package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.source.EmissionLineSource;
import nl.bytesoflife.spectrosim.source.SourceRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinLampsTest {

    @Test
    void arcLampsCarryTheirLineLists() {
        assertEquals(44, BuiltinLamps.argon().getLines().size());
        assertEquals(14, BuiltinLamps.mercury().getLines().size());
        assertEquals(30, BuiltinLamps.krypton().getLines().size());
        assertEquals(73, BuiltinLamps.neon().getLines().size());
        assertEquals(21, BuiltinLamps.xenon().getLines().size());
    }

    @Test
    void lampsAreCalibrationSources() {
        for (LampEntry lamp : BuiltinLamps.all()) {
            assertEquals(SourceRole.CALIBRATION, lamp.source().getRole(), lamp.name());
        }
    }

    @Test
    void allListsEveryLamp() {
        List<String> names = BuiltinLamps.all().stream().map(LampEntry::name).collect(Collectors.toList());
        assertEquals(List.of("PLANK", "Hg", "Ne", "Ar", "Kr", "Xe"), names);
    }

    @Test
    void factoriesReturnFreshInstances() {
        EmissionLineSource a = BuiltinLamps.neon();
        EmissionLineSource b = BuiltinLamps.neon();
        assertNotSame(a, b);
        a.setAttenuation(0.5);
        assertEquals(0.0, b.getAttenuation());
    }

    @Test
    void strongestArgonLinePeaks() {
        EmissionLineSource argon = BuiltinLamps.argon();
        assertTrue(argon.peakWavelength().isPresent());
        double peak = argon.peakWavelength().getAsDouble();
        assertTrue(peak > 0.7e-6 && peak < 2.5e-6);
    }

    @Test
    void planckLampIsSolarBlackbody() {
        assertEquals(5700, BuiltinLamps.planck().getTemperature());
        assertEquals(PhysicalConstants.WIEN_B / 5700, BuiltinLamps.planck().peakWavelength().getAsDouble(), 1e-15);
    }
}
