package nl.bytesoflife.spectrosim.detector;

import nl.bytesoflife.spectrosim.NoSignalException;
import nl.bytesoflife.spectrosim.NoSourceConfiguredException;
import nl.bytesoflife.spectrosim.ShapeMismatchException;
import nl.bytesoflife.spectrosim.axis.AxisKind;
import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import nl.bytesoflife.spectrosim.math.Integration;
import nl.bytesoflife.spectrosim.math.NoiseSampler;
import nl.bytesoflife.spectrosim.source.SpectralSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.random.RandomGenerator;

/**
 * Turns the radiance reaching the focal plane into electrons and ADU counts per pixel.
 *
 * <p>The chain is: radiance → irradiance (f-number cone) → photon flux per pixel (one pixel
 * spans {@code x / (R · pxPerResElement)} of the spectral axis) → electron rate (QE, binning
 * and thermal background) → electrons after shot and read noise → counts.
 *
 * <p>The random generator is owned by this model; seed it to make noisy runs reproducible.
 */
public class DetectorModel {

    private static final Logger log = LoggerFactory.getLogger(DetectorModel.class);

    private final DetectorConfig config;
    private final NoiseSampler noise;
    private SpectralSource source;

    public DetectorModel(DetectorConfig config, RandomGenerator rng) {
        this.config = config;
        this.noise = new NoiseSampler(rng);
    }

    public DetectorModel(DetectorConfig config, SpectralSource source, RandomGenerator rng) {
        this(config, rng);
        setSource(source);
    }

    public void setSource(SpectralSource source) {
        if (source != null && source.getKind() != SpectrumKind.RADIANCE) {
            throw new IllegalArgumentException("Detector needs a radiance source, '"
                    + source.getLabel() + "' emits " + source.getKind());
        }
        this.source = source;
    }

    public SpectralSource getSource() {
        return source;
    }

    public DetectorConfig getConfig() {
        return config;
    }

    private SpectralSource requireSource() {
        if (source == null) {
            throw new NoSourceConfiguredException();
        }
        return source;
    }

    /**
     * Spectral irradiance on the focal plane, {@code E = π / (4 f²) · I}.
     */
    public double[] irradiance(SpectralAxis axis) {
        double[] radiance = requireSource().density(axis);
        double f = config.getFNumber();
        double k = Math.PI / (4 * f * f);
        double[] out = new double[radiance.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = k * radiance[i];
        }
        return out;
    }

    /**
     * Width of the spectral interval that falls on one pixel, in units of the axis.
     */
    public double[] pixelBandwidth(SpectralAxis axis) {
        double[] out = new double[axis.size()];
        double k = config.getResolvingPower() * config.getPxPerResElement();
        for (int i = 0; i < out.length; i++) {
            out[i] = axis.value(i) / k;
        }
        return out;
    }

    /**
     * Photons per second landing on a pixel centred at each axis sample.
     */
    public double[] photonFluxPerPixel(SpectralAxis axis) {
        double[] e = irradiance(axis);
        double[] dh = pixelBandwidth(axis);
        double[] nu = axis.frequencies();
        double area = config.getPixelArea();

        double[] out = new double[e.length];
        for (int i = 0; i < out.length; i++) {
            double flux = dh[i] * e[i] * area / PhysicalConstants.photonEnergy(nu[i]);
            out[i] = Double.isNaN(flux) ? 0 : flux;
        }
        return out;
    }

    /**
     * Photoelectrons per second and pixel, thermal background included.
     */
    public double[] electronRate(SpectralAxis axis) {
        double[] photons = photonFluxPerPixel(axis);
        double[] qe = config.getQuantumEfficiency().getT(axis);
        double background = backgroundElectronRate();

        double[] out = new double[photons.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = qe[i] * photons[i] * config.getBinning() + background;
        }
        return out;
    }

    /**
     * Electrons per second excited by thermal photons from the cryostat, integrated over the
     * whole background band. The same for every pixel.
     */
    public double backgroundElectronRate() {
        ThermalBackground bg = config.getThermalBackground();
        if (bg == null) return 0;

        SpectralAxis band = SpectralAxis.wavelengthRange(bg.minWavelength(), bg.maxWavelength(), bg.samples());
        double[] wl = band.values();
        double[] qe = config.getQuantumEfficiency().getT(band);
        double area = config.getPixelArea();

        double[] perMetre = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            double photons = bg.radiationCone() * photonRadiance(wl[i], bg.cryostatTemperature())
                    + bg.mechanismCone() * photonRadiance(wl[i], bg.mechanismTemperature());
            perMetre[i] = qe[i] * photons * area;
        }

        double rate = Integration.simpson(perMetre, wl);
        log.debug("Thermal background: {} e-/s per pixel", rate);
        return rate;
    }

    /**
     * Electrons collected in {@code exposureTime} seconds. Noise adds a Poisson draw and a
     * Gaussian read-noise sample.
     */
    public double[] electrons(SpectralAxis axis, double exposureTime, boolean noisy) {
        if (exposureTime < 0) {
            throw new IllegalArgumentException("Exposure time must be >= 0: " + exposureTime);
        }
        double[] rate = electronRate(axis);
        double ron = ron(exposureTime);

        double[] out = new double[rate.length];
        for (int i = 0; i < out.length; i++) {
            double e = Math.max(0, rate[i] * exposureTime);
            if (noisy) {
                e = noise.gaussian(noise.poisson(e), ron);
            }
            out[i] = e;
        }
        return out;
    }

    public double[] counts(SpectralAxis axis, double exposureTime, boolean noisy) {
        return countsFromElectrons(axis, electrons(axis, exposureTime, noisy));
    }

    /**
     * ADU counts for electron values sampled over {@code axis}.
     */
    public double[] countsFromElectrons(SpectralAxis axis, double[] electrons) {
        if (electrons.length != axis.size()) {
            throw new ShapeMismatchException(axis.size(), electrons.length);
        }
        double[] out = new double[electrons.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.rint(electrons[i] / config.getGain());
        }
        return out;
    }

    public double gain() {
        return config.getGain();
    }

    public ReadNoise readNoise() {
        return config.getReadNoise();
    }

    public double ron(double exposureTime) {
        return config.getReadNoise().sigma(exposureTime);
    }

    /**
     * Exposure time after which the brightest sample reaches {@code saturation} counts,
     * assuming the noise-free count rate stays linear. The rate itself is not rounded, but a
     * pixel that would read 0 counts after one second counts as no signal.
     *
     * @throws NoSignalException if the brightest sample rounds to 0 counts after one second
     */
    public MaxExposure maxExposureTime(SpectralAxis axis, double saturation) {
        double[] perSecond = electrons(axis, 1, false);
        int best = 0;
        for (int i = 1; i < perSecond.length; i++) {
            if (perSecond[i] > perSecond[best]) best = i;
        }
        double countRate = perSecond[best] / config.getGain();
        if (!(Math.rint(countRate) > 0)) {
            throw new NoSignalException();
        }

        SpectralAxis wl = axis.as(AxisKind.WAVELENGTH);
        SpectralAxis nu = axis.as(AxisKind.FREQUENCY);
        return new MaxExposure(saturation / countRate, wl.value(best), nu.value(best), best);
    }

    private static double photonRadiance(double wavelength, double temperature) {
        double energy = PhysicalConstants.PLANCK_CONSTANT * PhysicalConstants.SPEED_OF_LIGHT / wavelength;
        return PhysicalConstants.planckWavelength(wavelength, temperature) / energy;
    }
}
