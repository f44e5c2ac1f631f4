package nl.bytesoflife.spectrosim.detector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DetectorConfigTest {

    @Test
    void defaultsDescribeNirDetector() {
        DetectorConfig config = new DetectorConfig();
        assertEquals(13.3e-6, config.getPixelSize());
        assertEquals(13.3e-6 * 13.3e-6, config.getPixelArea(), 1e-24);
        assertEquals(3000, config.getResolvingPower());
        assertEquals(2.2, config.getPxPerResElement());
        assertEquals(1, config.getBinning());
        assertEquals(1, config.getGain());
        assertEquals(17.37, config.getFNumber());
        assertEquals(5, config.getReadNoise().sigma(10));
        assertEquals(5, config.getReadNoise().sigma(1000));
        assertNull(config.getThermalBackground());
    }

    @Test
    void invalidValuesAreRejected() {
        DetectorConfig config = new DetectorConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withGain(0));
        assertThrows(IllegalArgumentException.class, () -> config.withPixelSize(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withResolvingPower(0));
        assertThrows(IllegalArgumentException.class, () -> config.withFNumber(0));
        assertThrows(IllegalArgumentException.class, () -> config.withBinning(0));
        assertThrows(IllegalArgumentException.class, () -> config.withQuantumEfficiency(1.5));
    }

    @Test
    void thermalBackgroundDefaults() {
        ThermalBackground bg = ThermalBackground.of(1.2, 0.4, 130);
        assertEquals(125, bg.mechanismTemperature());
        assertEquals(0.4e-6, bg.minWavelength());
        assertEquals(2.6e-6, bg.maxWavelength());
        assertEquals(2001, bg.samples());
    }

    @Test
    void thermalBackgroundNeedsOddSampleCount() {
        assertThrows(IllegalArgumentException.class,
                () -> new ThermalBackground(1, 1, 130, 125, 0.4e-6, 2.6e-6, 2000));
    }

    @Test
    void readNoiseRejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new ReadNoise(-1, 5, 120));
    }
}
