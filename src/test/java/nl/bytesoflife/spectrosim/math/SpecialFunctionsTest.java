package nl.bytesoflife.spectrosim.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpecialFunctionsTest {

    @Test
    void erfMatchesReferenceValues() {
        assertEquals(0.0, SpecialFunctions.erf(0), 1e-6);
        assertEquals(0.8427007929, SpecialFunctions.erf(1), 1e-6);
        assertEquals(-0.8427007929, SpecialFunctions.erf(-1), 1e-6);
        assertEquals(0.9953222650, SpecialFunctions.erf(2), 1e-6);
    }

    @Test
    void erfcKeepsRelativePrecisionInTheTail() {
        double reference = 1.5374597944e-12; // erfc(5)
        assertEquals(reference, SpecialFunctions.erfc(5), reference * 1e-5);
    }

    @Test
    void normalIntervalOfWholeLineIsOne() {
        assertEquals(1.0, SpecialFunctions.normalInterval(-50, 50, 0, 1), 1e-7);
    }

    @Test
    void normalIntervalOfOneSigmaBand() {
        assertEquals(0.6826894921, SpecialFunctions.normalInterval(-1, 1, 0, 1), 1e-6);
        assertEquals(0.6826894921, SpecialFunctions.normalInterval(9, 11, 10, 1), 1e-6);
    }

    @Test
    void normalIntervalWithZeroSigmaIsIndicator() {
        assertEquals(1.0, SpecialFunctions.normalInterval(9.5, 10.5, 10, 0));
        assertEquals(0.0, SpecialFunctions.normalInterval(9.5, 10.5, 11, 0));
    }

    @Test
    void logGammaMatchesFactorials() {
        assertEquals(Math.log(24), SpecialFunctions.logGamma(5), 1e-12);
        assertEquals(0.0, SpecialFunctions.logGamma(1), 1e-12);
        assertEquals(Math.log(Math.sqrt(Math.PI)), SpecialFunctions.logGamma(0.5), 1e-12);
    }

    @Test
    void logGammaRejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> SpecialFunctions.logGamma(0));
    }

    @Test
    void poissonPmfMatchesClosedForm() {
        double mean = 2.5;
        double expected = Math.exp(-mean) * Math.pow(mean, 3) / 6;
        assertEquals(expected, SpecialFunctions.poissonPmf(3, mean), 1e-12);
    }

    @Test
    void poissonPmfSumsToOne() {
        double sum = 0;
        for (int k = 0; k < 100; k++) {
            sum += SpecialFunctions.poissonPmf(k, 12.3);
        }
        assertEquals(1.0, sum, 1e-10);
    }

    @Test
    void poissonPmfWithZeroMeanIsConcentratedAtZero() {
        assertEquals(1.0, SpecialFunctions.poissonPmf(0, 0));
        assertEquals(0.0, SpecialFunctions.poissonPmf(1, 0));
    }
}
