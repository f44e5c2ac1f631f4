package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinGratingsTest {

    @Test
    void harmoniHasElevenGratings() {
        List<Grating> gratings = BuiltinGratings.harmoni();
        assertEquals(11, gratings.size());
        assertSame(gratings, BuiltinGratings.harmoni());
    }

    @Test
    void everyGratingRefersToKnownFilterAndEqualizer() {
        for (Grating grating : BuiltinGratings.harmoni()) {
            assertTrue(BuiltinGratings.filterNames().contains(grating.filter()), grating.name());
            assertTrue(BuiltinGratings.equalizerNames().contains(grating.equalizer()), grating.name());
        }
    }

    @Test
    void samplingGridSpansBand() {
        Grating mr4 = new Grating("MR4", "K", "MR4", 7050, 1.951e-6, 2.469e-6);
        SpectralAxis grid = mr4.samplingGrid(101);

        assertEquals(101, grid.size());
        assertEquals(1.951e-6, grid.value(0), 1e-18);
        assertEquals(2.469e-6, grid.value(100), 1e-18);
        assertEquals(2.21e-6, mr4.centreWavelength(), 1e-18);
    }

    @Test
    void invalidGratingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Grating("X", "J", "X", 0, 1e-6, 2e-6));
        assertThrows(IllegalArgumentException.class, () -> new Grating("X", "J", "X", 1000, 2e-6, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new Grating(" ", "J", "X", 1000, 1e-6, 2e-6));
    }
}
