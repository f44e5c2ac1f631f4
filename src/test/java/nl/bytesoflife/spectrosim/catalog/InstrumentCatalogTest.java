package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.UndefinedGratingException;
import nl.bytesoflife.spectrosim.UndefinedStageException;
import nl.bytesoflife.spectrosim.optics.FlatStage;
import nl.bytesoflife.spectrosim.optics.OpticalElement;
import nl.bytesoflife.spectrosim.optics.Pipeline;
import nl.bytesoflife.spectrosim.source.BlackbodySource;
import nl.bytesoflife.spectrosim.source.SourceRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentCatalogTest {

    private InstrumentCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new InstrumentCatalog();
        for (String stage : List.of(InstrumentCatalog.SCAO_DICHROIC, InstrumentCatalog.LTAO_DICHROIC,
                InstrumentCatalog.FIBERS, InstrumentCatalog.OFFNER, InstrumentCatalog.FPRS,
                InstrumentCatalog.CRYOSTAT, InstrumentCatalog.PREOPTICS, InstrumentCatalog.IFU,
                InstrumentCatalog.SPECTROGRAPH, InstrumentCatalog.MISALIGNMENTS, InstrumentCatalog.DETECTOR)) {
            catalog.registerStage(stage, FlatStage.allPass(stage));
        }
        for (String filter : BuiltinGratings.filterNames()) {
            catalog.registerFilter(filter, FlatStage.allPass("Filter " + filter));
        }
        for (String equalizer : BuiltinGratings.equalizerNames()) {
            catalog.registerEqualizer(equalizer, FlatStage.allPass("Equalizer " + equalizer));
        }
        for (Grating grating : BuiltinGratings.harmoni()) {
            catalog.registerGrating(grating);
        }
    }

    private static List<String> labels(Pipeline pipeline) {
        return pipeline.getStages().stream().map(OpticalElement::getLabel).collect(Collectors.toList());
    }

    @Test
    void calibrationResponseGoesThroughFibres() {
        Pipeline response = catalog.makeResponse("MR2", "NOAO", true);

        assertEquals(InstrumentCatalog.RESPONSE_LABEL, response.getLabel());
        assertEquals(List.of("Fibers*", "Offner", "FPRS", "Cryostat", "Preoptics", "IFU", "Spectrograph",
                "Filter J", "Equalizer MR2", "Misalignments", "Detector"), labels(response));
    }

    @Test
    void skyResponseSkipsCalibrationOptics() {
        Pipeline response = catalog.makeResponse("HR4", "NOAO", false);

        assertEquals(List.of("FPRS", "Cryostat", "Preoptics", "IFU", "Spectrograph",
                "Filter K (long)", "Equalizer HR4", "Misalignments", "Detector"), labels(response));
    }

    @Test
    void aoModeAddsDichroicFirst() {
        assertEquals("SCAO Dichroic", labels(catalog.makeResponse("VIS", "scao", false)).get(0));
        assertEquals("LTAO Dichroic", labels(catalog.makeResponse("VIS", "LTAO", true)).get(0));
        assertEquals(10, catalog.makeResponse("VIS", "LTAO", false).size());
    }

    @Test
    void gratingLookupIgnoresCase() {
        assertEquals("LR1", catalog.getGrating("lr1").name());
        assertEquals(11, catalog.getGratingNames().size());
    }

    @Test
    void unknownGratingIsReported() {
        UndefinedGratingException ex = assertThrows(UndefinedGratingException.class,
                () -> catalog.makeResponse("XR9", "NOAO", false));
        assertEquals("XR9", ex.getGrating());
    }

    @Test
    void unknownAoModeIsReported() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> catalog.makeResponse("MR1", "MCAO", false));
        assertTrue(ex.getMessage().contains("MCAO"));
    }

    @Test
    void missingStageIsReported() {
        InstrumentCatalog empty = new InstrumentCatalog()
                .registerFilter("J", FlatStage.allPass("J"))
                .registerEqualizer("MR2", FlatStage.allPass("MR2"))
                .registerGrating(new Grating("MR2", "J", "MR2", 7050, 1.046e-6, 1.324e-6));

        UndefinedStageException ex = assertThrows(UndefinedStageException.class,
                () -> empty.makeResponse("MR2", "NOAO", false));
        assertEquals("FPRS", ex.getStage());
    }

    @Test
    void gratingNeedsKnownFilter() {
        InstrumentCatalog empty = new InstrumentCatalog();
        assertThrows(UndefinedStageException.class,
                () -> empty.registerGrating(new Grating("MR2", "J", "MR2", 7050, 1.046e-6, 1.324e-6)));
    }

    @Test
    void lampsDefaultToCalibrationRole() {
        catalog.registerLamp("Tungsten", new BlackbodySource(3200), "Quartz halogen");

        LampEntry lamp = catalog.getLamp("Tungsten");
        assertEquals(SourceRole.CALIBRATION, lamp.source().getRole());
        assertEquals("Quartz halogen", lamp.description());
        assertThrows(IllegalArgumentException.class, () -> catalog.getLamp("Sodium"));
    }

    @Test
    void explicitLampRoleIsKept() {
        BlackbodySource sky = new BlackbodySource(280);
        sky.setRole(SourceRole.SKY);
        catalog.registerLamp("Sky", sky, "Thermal sky");
        assertEquals(SourceRole.SKY, catalog.getLamp("Sky").source().getRole());
    }

    @Test
    void responseTransmitsWhenAllStagesPass() {
        Pipeline response = catalog.makeResponse("MR2", "SCAO", true);
        Grating mr2 = catalog.getGrating("MR2");
        for (double t : response.getT(mr2.samplingGrid(5))) {
            assertEquals(1.0, t, 1e-15);
        }
    }
}
