package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.math.TabulatedCurve;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentPartStageTest {

    @Test
    void dustThroughputDependsOnSurfaceCount() {
        InstrumentPartStage relay = new InstrumentPartStage("Relay", 280)
                .withFlatMirrors(4, 0.98)
                .withFlatLenses(2, 0.99)
                .withDust(0.002, 0.005);

        double expected = Math.pow(1 - 0.5 * 0.005, 4) * Math.pow(1 - 0.5 * 0.002, 2);
        assertEquals(expected, relay.getDustThroughput(), 1e-15);
    }

    @Test
    void transmittanceCombinesElementsAndDust() {
        InstrumentPartStage relay = new InstrumentPartStage("Relay", 280)
                .withFlatMirrors(3, 0.97);

        double dust = Math.pow(1 - 0.5 * InstrumentPartStage.DEFAULT_MIRROR_DUST, 3);
        assertEquals(Math.pow(0.97, 3) * dust, relay.getT(1.5e-6), 1e-12);
    }

    @Test
    void flatElementsAreOpaqueOutsideTheirBand() {
        InstrumentPartStage relay = new InstrumentPartStage("Relay", 280).withFlatMirrors(1, 0.97);
        assertEquals(0.0, relay.getT(3e-6));
    }

    @Test
    void areaScalingScalesDustLoss() {
        InstrumentPartStage part = new InstrumentPartStage("Part", 280)
                .withFlatMirrors(2, 1.0)
                .withDustEmissivity(1.0)
                .withAreaScaling(3);

        double unscaled = Math.pow(1 - InstrumentPartStage.DEFAULT_MIRROR_DUST, 2);
        assertEquals(1 - (1 - unscaled) * 3, part.getDustThroughput(), 1e-15);
    }

    @Test
    void tabulatedMirrorCurveIsInterpolated() {
        TabulatedCurve coating = new TabulatedCurve(new double[]{1e-6, 2e-6}, new double[]{0.9, 1.0});
        InstrumentPartStage part = new InstrumentPartStage("Part", 0)
                .withMirrors(2, coating)
                .withDust(0, 0);
        assertEquals(0.95 * 0.95, part.getT(1.5e-6), 1e-12);
        assertEquals(2, part.getMirrorCount());
        assertEquals(0, part.getLensCount());
    }

    @Test
    void negativeElementCountIsRejected() {
        InstrumentPartStage part = new InstrumentPartStage("Part", 0);
        assertThrows(IllegalArgumentException.class, () -> part.withFlatMirrors(-1, 0.9));
    }
}
