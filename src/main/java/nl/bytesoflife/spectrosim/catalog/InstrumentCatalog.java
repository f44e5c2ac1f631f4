package nl.bytesoflife.spectrosim.catalog;

import nl.bytesoflife.spectrosim.UndefinedGratingException;
import nl.bytesoflife.spectrosim.UndefinedStageException;
import nl.bytesoflife.spectrosim.optics.OpticalElement;
import nl.bytesoflife.spectrosim.optics.OpticalStage;
import nl.bytesoflife.spectrosim.optics.Pipeline;
import nl.bytesoflife.spectrosim.source.SourceRole;
import nl.bytesoflife.spectrosim.source.SpectralSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory registry of the instrument's optical stages, passband filters, equalizers,
 * gratings, lamps, sphere coatings and spaxel scales. Curves are loaded elsewhere and registered here.
 */
public class InstrumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(InstrumentCatalog.class);

    public static final String SCAO_DICHROIC = "SCAO Dichroic";
    public static final String LTAO_DICHROIC = "LTAO Dichroic";
    public static final String FIBERS = "Fibers*";
    public static final String OFFNER = "Offner";
    public static final String FPRS = "FPRS";
    public static final String CRYOSTAT = "Cryostat";
    public static final String PREOPTICS = "Preoptics";
    public static final String IFU = "IFU";
    public static final String SPECTROGRAPH = "Spectrograph";
    public static final String MISALIGNMENTS = "Misalignments";
    public static final String DETECTOR = "Detector";

    public static final String RESPONSE_LABEL = "Instrument response";

    private final Map<String, OpticalElement> stages = new LinkedHashMap<>();
    private final Map<String, OpticalElement> filters = new LinkedHashMap<>();
    private final Map<String, OpticalElement> equalizers = new LinkedHashMap<>();
    private final Map<String, Grating> gratings = new LinkedHashMap<>();
    private final Map<String, LampEntry> lamps = new LinkedHashMap<>();
    private final Map<String, CoatingEntry> coatings = new LinkedHashMap<>();
    private final Map<String, SpaxelScale> scales = new LinkedHashMap<>();

    public InstrumentCatalog registerStage(String name, OpticalElement stage) {
        stages.put(name, stage);
        log.debug("Registered stage '{}'", name);
        return this;
    }

    public InstrumentCatalog registerFilter(String name, OpticalElement filter) {
        filters.put(name, filter);
        log.debug("Registered passband filter '{}'", name);
        return this;
    }

    public InstrumentCatalog registerEqualizer(String name, OpticalElement equalizer) {
        equalizers.put(name, equalizer);
        log.debug("Registered equalizer '{}'", name);
        return this;
    }

    /**
     * Registers a grating. Its filter and equalizer must already be known.
     */
    public InstrumentCatalog registerGrating(Grating grating) {
        if (!filters.containsKey(grating.filter())) {
            throw new UndefinedStageException("Filter: " + grating.filter());
        }
        if (!equalizers.containsKey(grating.equalizer())) {
            throw new UndefinedStageException("Equalizer: " + grating.equalizer());
        }
        gratings.put(grating.name().toUpperCase(Locale.ROOT), grating);
        log.debug("Registered grating {} (R={}, {} - {} m)", grating.name(), grating.resolvingPower(),
                grating.minWavelength(), grating.maxWavelength());
        return this;
    }

    public InstrumentCatalog registerLamp(String name, SpectralSource source, String description) {
        if (source.getRole() == null) {
            source.setRole(SourceRole.CALIBRATION);
        }
        lamps.put(name, new LampEntry(name, source, description));
        return this;
    }

    public InstrumentCatalog registerLamp(LampEntry entry) {
        return registerLamp(entry.name(), entry.source(), entry.description());
    }

    /**
     * Registers a sphere coating. Its reflectance curve is also reachable as a stage under the
     * coating name.
     */
    public InstrumentCatalog registerCoating(String name, String description, OpticalStage reflectance) {
        coatings.put(name, new CoatingEntry(name, description, reflectance));
        return registerStage(name, reflectance);
    }

    public InstrumentCatalog registerScale(SpaxelScale scale) {
        scales.put(scale.name(), scale);
        log.debug("Registered spaxel scale {} ({} x {} mas)", scale.name(), scale.spaxelX(), scale.spaxelY());
        return this;
    }

    public OpticalElement getStage(String name) {
        OpticalElement stage = stages.get(name);
        if (stage == null) {
            throw new UndefinedStageException(name);
        }
        return stage;
    }

    public OpticalElement getFilter(String name) {
        OpticalElement filter = filters.get(name);
        if (filter == null) {
            throw new UndefinedStageException("Filter: " + name);
        }
        return filter;
    }

    public OpticalElement getEqualizer(String name) {
        OpticalElement equalizer = equalizers.get(name);
        if (equalizer == null) {
            throw new UndefinedStageException("Equalizer: " + name);
        }
        return equalizer;
    }

    public Grating getGrating(String name) {
        Grating grating = gratings.get(name.toUpperCase(Locale.ROOT));
        if (grating == null) {
            throw new UndefinedGratingException(name);
        }
        return grating;
    }

    public LampEntry getLamp(String name) {
        LampEntry lamp = lamps.get(name);
        if (lamp == null) {
            throw new IllegalArgumentException("No such lamp: " + name);
        }
        return lamp;
    }

    public CoatingEntry getCoating(String name) {
        CoatingEntry coating = coatings.get(name);
        if (coating == null) {
            throw new UndefinedStageException("Coating: " + name);
        }
        return coating;
    }

    public Optional<SpaxelScale> getScale(int nominalX, int nominalY) {
        return Optional.ofNullable(scales.get(nominalX + "x" + nominalY));
    }

    public List<String> getStageNames() {
        return new ArrayList<>(stages.keySet());
    }

    public List<String> getFilterNames() {
        return new ArrayList<>(filters.keySet());
    }

    public List<String> getEqualizerNames() {
        return new ArrayList<>(equalizers.keySet());
    }

    public List<String> getGratingNames() {
        return new ArrayList<>(gratings.keySet());
    }

    public List<String> getLampNames() {
        return new ArrayList<>(lamps.keySet());
    }

    public List<String> getCoatingNames() {
        return new ArrayList<>(coatings.keySet());
    }

    public List<SpaxelScale> getScales() {
        return new ArrayList<>(scales.values());
    }

    /**
     * Assembles the instrument train for a grating and AO mode. Calibration light enters
     * through the fibres and the Offner relay; sky light does not.
     *
     * @throws UndefinedGratingException if the grating is unknown
     * @throws UndefinedStageException   if a required stage was never registered
     * @throws IllegalArgumentException  if the AO mode is unknown
     */
    public Pipeline makeResponse(String grating, String aoMode, boolean calibration) {
        AoMode ao = AoMode.fromName(aoMode);
        Pipeline response = new Pipeline(RESPONSE_LABEL);

        if (ao.getDichroicStage() != null) {
            response.pushBack(getStage(ao.getDichroicStage()));
        }
        if (calibration) {
            response.pushBack(getStage(FIBERS));
            response.pushBack(getStage(OFFNER));
        }

        response.pushBack(getStage(FPRS));
        response.pushBack(getStage(CRYOSTAT));
        response.pushBack(getStage(PREOPTICS));
        response.pushBack(getStage(IFU));
        response.pushBack(getStage(SPECTROGRAPH));

        Grating gr = getGrating(grating);
        response.pushBack(getFilter(gr.filter()));
        response.pushBack(getEqualizer(gr.equalizer()));

        response.pushBack(getStage(MISALIGNMENTS));
        response.pushBack(getStage(DETECTOR));

        log.debug("Assembled {} stage response for {} / {} ({})", response.size(), gr.name(), ao,
                calibration ? "calibration" : "sky");
        return response;
    }
}
