package nl.bytesoflife.spectrosim.exposure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExposureTimeDistributionTest {

    @Test
    void peakAndIntegral() {
        ExposureTimeDistribution d = new ExposureTimeDistribution(
                new double[]{0, 1, 2}, new double[]{0, 1, 0});
        assertEquals(1.0, d.peakExposureTime());
        assertEquals(1.0, d.integral(), 1e-15);
    }

    @Test
    void arraysAreCopied() {
        double[] density = {0, 1, 0};
        ExposureTimeDistribution d = new ExposureTimeDistribution(new double[]{0, 1, 2}, density);
        density[1] = 5;
        d.density()[1] = 7;
        assertEquals(1.0, d.density()[1]);
    }

    @Test
    void lengthsMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExposureTimeDistribution(new double[]{0, 1}, new double[]{1}));
    }
}
