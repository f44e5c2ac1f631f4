package nl.bytesoflife.spectrosim.source;

import nl.bytesoflife.spectrosim.axis.PhysicalConstants;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import nl.bytesoflife.spectrosim.optics.OpticalStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Integrating sphere fed by one or more lamps. The lamp power is converted into the radiance
 * leaving the output port:
 *
 * <pre>
 *   A       = 4 π r²
 *   ρ(λ)    = ρ_coating(λ) · (1 − aperture / A)
 *   L(λ)    = ρ / ((1 − ρ) · A) · Σ P_lamp(λ)  +  (1 − ρ_coating(λ)) · B(λ, T_wall)
 * </pre>
 *
 * The coating reflectance is supplied as an optical stage whose transmittance is read as the
 * reflectance of the wall.
 */
public class IntegratingSphereSource extends AbstractSpectralSource {

    private static final Logger log = LoggerFactory.getLogger(IntegratingSphereSource.class);

    public static final double DEFAULT_WALL_TEMPERATURE = 273.15;

    private final double radius;
    private final double apertureArea;
    private final OpticalStage coating;
    private final List<SpectralSource> lamps = new ArrayList<>();
    private double wallTemperature = DEFAULT_WALL_TEMPERATURE;

    public IntegratingSphereSource(String label, double radius, double apertureArea, OpticalStage coating) {
        super(label);
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Sphere radius must be positive: " + radius);
        }
        if (!(apertureArea > 0)) {
            throw new IllegalArgumentException("Aperture area must be positive: " + apertureArea);
        }
        this.radius = radius;
        this.apertureArea = apertureArea;
        this.coating = coating;
        if (apertureArea >= getSphereArea()) {
            throw new IllegalArgumentException("Aperture area exceeds the sphere surface");
        }
    }

    public IntegratingSphereSource addLamp(SpectralSource lamp) {
        if (lamp.getKind() != SpectrumKind.POWER_DENSITY) {
            throw new IllegalArgumentException("Lamp '" + lamp.getLabel()
                    + "' must emit a power density to feed a sphere");
        }
        lamps.add(lamp);
        log.debug("Sphere '{}' now fed by {} lamp(s)", getLabel(), lamps.size());
        return this;
    }

    public IntegratingSphereSource withWallTemperature(double temperature) {
        if (temperature < 0) {
            throw new IllegalArgumentException("Wall temperature must be >= 0: " + temperature);
        }
        this.wallTemperature = temperature;
        return this;
    }

    public List<SpectralSource> getLamps() {
        return Collections.unmodifiableList(lamps);
    }

    public double getSphereArea() {
        return 4 * Math.PI * radius * radius;
    }

    public double getGeometricEfficiency() {
        return 1 - apertureArea / getSphereArea();
    }

    public double getWallTemperature() {
        return wallTemperature;
    }

    @Override
    public SpectrumKind getKind() {
        return SpectrumKind.RADIANCE;
    }

    @Override
    protected double[] wavelengthDensity(double[] wavelengths) {
        return rawDensity(SpectralAxis.wavelength(wavelengths));
    }

    @Override
    protected double[] rawDensity(SpectralAxis axis) {
        double sphereArea = getSphereArea();
        double geometric = getGeometricEfficiency();
        double[] reflectance = coating.getT(axis);

        double[] power = new double[axis.size()];
        for (SpectralSource lamp : lamps) {
            double[] p = lamp.density(axis);
            for (int i = 0; i < power.length; i++) {
                power[i] += p[i];
            }
        }

        double[] out = new double[axis.size()];
        for (int i = 0; i < out.length; i++) {
            double rho = reflectance[i] * geometric;
            double conversion = rho / ((1 - rho) * sphereArea);
            double wall = axis.isWavelength()
                    ? PhysicalConstants.planckWavelength(axis.value(i), wallTemperature)
                    : PhysicalConstants.planckFrequency(axis.value(i), wallTemperature);
            out[i] = conversion * power[i] + (1 - reflectance[i]) * wall;
        }
        return out;
    }

    @Override
    public OptionalDouble peakWavelength() {
        return OptionalDouble.empty();
    }
}
