package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.math.Integration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmissionLineSourceTest {

    private static final double PEAK_FLUX = 0.1;

    @Test
    void strongestLineCarriesItsShareOfPeakFlux() {
        EmissionLineSource lamp = new EmissionLineSource("Ar", PEAK_FLUX, 1000, 0)
                .addLineMicrometres(1.0, 1, 40);

        SpectralAxis axis = SpectralAxis.wavelengthRange(0.999e-6, 1.001e-6, 20001);
        double integral = Integration.trapezoid(lamp.density(axis), axis.values());

        assertEquals(PEAK_FLUX / (4 * Math.PI), integral, PEAK_FLUX / (4 * Math.PI) * 1e-3);
    }

    @Test
    void weakerLinesScaleWithRelativeFlux() {
        EmissionLineSource lamp = new EmissionLineSource("Ne", PEAK_FLUX, 1000, 0)
                .addLineMicrometres(1.0, 1000, 20.18)
                .addLineMicrometres(1.2, 250, 20.18);

        SpectralAxis strong = SpectralAxis.wavelengthRange(0.998e-6, 1.002e-6, 20001);
        SpectralAxis weak = SpectralAxis.wavelengthRange(1.198e-6, 1.202e-6, 20001);
        double a = Integration.trapezoid(lamp.density(strong), strong.values());
        double b = Integration.trapezoid(lamp.density(weak), weak.values());

        assertEquals(0.25, b / a, 1e-3);
    }

    @Test
    void coarseGridWidensLinesInsteadOfMissingThem() {
        EmissionLineSource lamp = new EmissionLineSource("Ar", PEAK_FLUX, 1000, 0)
                .addLineMicrometres(1.00003, 1, 40);

        // 0.1 nm sampling is far coarser than the Doppler width
        SpectralAxis axis = SpectralAxis.wavelengthRange(0.99e-6, 1.01e-6, 201);
        double integral = Integration.trapezoid(lamp.density(axis), axis.values());

        assertEquals(PEAK_FLUX / (4 * Math.PI), integral, PEAK_FLUX / (4 * Math.PI) * 0.05);
    }

    @Test
    void continuumIsFractionOfPeakFlux() {
        EmissionLineSource lamp = new EmissionLineSource("Kr", PEAK_FLUX, 1000, 0.1)
                .addLineMicrometres(0.8, 1, 83.8);

        double[] d = lamp.density(SpectralAxis.wavelength(2.0e-6, 2.1e-6));
        assertArrayEquals(new double[]{0.01, 0.01}, d, 1e-15);
    }

    @Test
    void linesOutsideRequestedRangeAreSkipped() {
        EmissionLineSource lamp = new EmissionLineSource("Hg", PEAK_FLUX, 1000, 0)
                .addLineMicrometres(0.546227, 6000, 200.59);
        double[] d = lamp.density(SpectralAxis.wavelength(1.5e-6, 1.6e-6));
        assertArrayEquals(new double[]{0, 0}, d);
    }

    @Test
    void peakIsStrongestLine() {
        EmissionLineSource lamp = new EmissionLineSource("Xe", PEAK_FLUX, 1000, 0.1)
                .addLineMicrometres(0.828239, 7000, 131.3)
                .addLineMicrometres(0.882183, 5000, 131.3)
                .addLineMicrometres(1.673273, 5000, 131.3);
        assertEquals(0.828239e-6, lamp.peakWavelength().getAsDouble(), 1e-15);
        assertEquals(3, lamp.getLines().size());
    }

    @Test
    void lampWithoutLinesHasNoPeak() {
        EmissionLineSource lamp = new EmissionLineSource("Empty", PEAK_FLUX, 1000, 0.1);
        assertTrue(lamp.peakWavelength().isEmpty());
        assertArrayEquals(new double[]{0.01}, lamp.density(SpectralAxis.wavelength(1e-6)), 1e-15);
    }

    @Test
    void dopplerWidthGrowsWithTemperature() {
        EmissionLineSource cold = new EmissionLineSource("A", PEAK_FLUX, 500, 0);
        EmissionLineSource hot = new EmissionLineSource("B", PEAK_FLUX, 2000, 0);
        assertEquals(2.0, hot.relativeDopplerWidth() / cold.relativeDopplerWidth(), 1e-12);
    }

    @Test
    void invalidLinesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EmissionLine(-1e-6, 1, 40));
        assertThrows(IllegalArgumentException.class, () -> new EmissionLine(1e-6, -1, 40));
        assertThrows(IllegalArgumentException.class, () -> new EmissionLine(1e-6, 1, 0));
    }
}
