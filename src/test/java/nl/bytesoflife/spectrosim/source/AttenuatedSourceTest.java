package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.PowerNotAdjustableException;
import nl.bytesoflife.spectrosim.axis.AxisKind;
import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.math.TabulatedCurve;
import nl.bytesoflife.spectrosim.optics.FlatStage;
import nl.bytesoflife.spectrosim.optics.Pipeline;
import nl.bytesoflife.spectrosim.optics.TabulatedStage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttenuatedSourceTest {

    private static final SpectralAxis AXIS = SpectralAxis.wavelength(0.8e-6, 1.6e-6);

    @Test
    void densityIsThreadedThroughResponse() {
        BlackbodySource lamp = new BlackbodySource(5700);
        Pipeline response = new Pipeline("Instrument response")
                .pushBack(new FlatStage("A", 0, 0.5))
                .pushBack(new FlatStage("B", 0, 0.4));
        AttenuatedSource seen = new AttenuatedSource(lamp, response);

        double[] raw = lamp.density(AXIS);
        double[] d = seen.density(AXIS);
        for (int i = 0; i < AXIS.size(); i++) {
            assertEquals(0.2 * raw[i], d[i], raw[i] * 1e-15);
        }
        assertEquals("Blackbody 5700.0 K through Instrument response", seen.getLabel());
    }

    @Test
    void warmResponseAddsGraybody() {
        BlackbodySource lamp = new BlackbodySource(5700);
        AttenuatedSource seen = new AttenuatedSource(lamp, new FlatStage("Window", 280, 0.5));

        double wl = 2.2e-6;
        double expected = 0.5 * PhysicalConstants.planckWavelength(wl, 5700)
                + 0.5 * PhysicalConstants.planckWavelength(wl, 280);
        assertEquals(expected, seen.density(wl), expected * 1e-12);
    }

    @Test
    void photonRateUsesAttenuatedDensity() {
        BlackbodySource lamp = new BlackbodySource(5700);
        AttenuatedSource seen = new AttenuatedSource(lamp, new FlatStage("Half", 0, 0.5));
        double[] direct = lamp.photonRate(AXIS);
        double[] halved = seen.photonRate(AXIS);
        for (int i = 0; i < AXIS.size(); i++) {
            assertEquals(0.5 * direct[i], halved[i], direct[i] * 1e-12);
        }
    }

    @Test
    void attenuationAndPowerAreDelegated() {
        BlackbodySource lamp = new BlackbodySource(5700);
        AttenuatedSource seen = new AttenuatedSource(lamp, new FlatStage("Pass", 0, 1));

        seen.setAttenuation(0.3);
        assertEquals(0.3, lamp.getAttenuation());
        assertEquals(0.3, seen.getAttenuation());

        assertThrows(PowerNotAdjustableException.class, () -> seen.adjustPower(10));
        lamp.setNominalPowerRating(20);
        seen.adjustPower(10);
        assertEquals(0.5, lamp.getPowerFactor(), 1e-15);

        double expected = 0.5 * 0.7 * PhysicalConstants.planckWavelength(1e-6, 5700);
        assertEquals(expected, seen.density(1e-6), expected * 1e-12);
    }

    @Test
    void peakIsSearchedOnNativeGridAfterAttenuation() {
        TabulatedSource lamp = TabulatedSource.radiance("Lamp",
                new TabulatedCurve(new double[]{1e-6, 2e-6, 3e-6}, new double[]{1, 5, 4}));
        TabulatedStage notch = TabulatedStage.fromThroughput("Notch", 0,
                new TabulatedCurve(new double[]{0.5e-6, 2e-6, 3.5e-6}, new double[]{1, 0.1, 1}));

        AttenuatedSource seen = new AttenuatedSource(lamp, notch);

        assertEquals(2e-6, lamp.peakWavelength().getAsDouble());
        assertEquals(3e-6, seen.peakWavelength().getAsDouble());
        assertEquals(PhysicalConstants.SPEED_OF_LIGHT / 3e-6, seen.peakFrequency().getAsDouble(), 1e-3);
    }

    @Test
    void peakFallsBackToWrappedSource() {
        BlackbodySource lamp = new BlackbodySource(5700);
        AttenuatedSource seen = new AttenuatedSource(lamp, new FlatStage("Pass", 0, 0.5));
        assertEquals(lamp.peakWavelength().getAsDouble(), seen.peakWavelength().getAsDouble());
    }

    @Test
    void frequencyAxisIsSupported() {
        BlackbodySource lamp = new BlackbodySource(5700);
        AttenuatedSource seen = new AttenuatedSource(lamp, new FlatStage("Half", 0, 0.5));
        SpectralAxis nu = AXIS.as(AxisKind.FREQUENCY);
        double[] raw = lamp.density(nu);
        double[] d = seen.density(nu);
        for (int i = 0; i < nu.size(); i++) {
            assertEquals(0.5 * raw[i], d[i], raw[i] * 1e-15);
        }
    }
}
