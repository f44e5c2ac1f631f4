package nl.bytesoflife.spectrosim.axis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhysicalConstantsTest {

    @Test
    void planckFormsAgreeAcrossJacobian() {
        double t = 3000;
        for (double wl : new double[]{0.4e-6, 1e-6, 2.5e-6, 10e-6}) {
            double nu = PhysicalConstants.SPEED_OF_LIGHT / wl;
            double perMetre = PhysicalConstants.planckWavelength(wl, t);
            double perHertz = PhysicalConstants.planckFrequency(nu, t);
            assertEquals(perMetre * wl * wl / PhysicalConstants.SPEED_OF_LIGHT, perHertz, perHertz * 1e-9);
        }
    }

    @Test
    void planckIsZeroAtZeroTemperature() {
        assertEquals(0, PhysicalConstants.planckWavelength(1e-6, 0));
        assertEquals(0, PhysicalConstants.planckFrequency(3e14, 0));
    }

    @Test
    void planckUnderflowsToZeroForVeryColdBodies() {
        assertEquals(0, PhysicalConstants.planckWavelength(0.5e-6, 10));
    }

    @Test
    void planckPeaksAtWienWavelength() {
        double t = 5700;
        double peak = PhysicalConstants.WIEN_B / t;
        double atPeak = PhysicalConstants.planckWavelength(peak, t);
        assertTrue(atPeak > PhysicalConstants.planckWavelength(peak * 0.95, t));
        assertTrue(atPeak > PhysicalConstants.planckWavelength(peak * 1.05, t));
    }

    @Test
    void photonEnergyIsPlanckTimesFrequency() {
        assertEquals(6.62607015e-34 * 5e14, PhysicalConstants.photonEnergy(5e14), 1e-30);
    }
}
