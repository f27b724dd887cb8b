package com.chicu.airetrain.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StudentPairedTTestTest {

    private final StudentPairedTTest test = new StudentPairedTTest();

    @Test
    void consistentImprovement_shouldBeSignificant() {
        double[] candidate = {0.08, 0.09, 0.085, 0.095, 0.09, 0.088, 0.092, 0.087};
        double[] baseline = {0.10, 0.11, 0.10, 0.105, 0.10, 0.099, 0.104, 0.101};

        double p = test.pValue(candidate, baseline);

        assertTrue(p < 0.01, "p=" + p);
    }

    @Test
    void noisyDifferences_shouldNotBeSignificant() {
        double[] candidate = {0.10, 0.12, 0.08, 0.11, 0.09};
        double[] baseline = {0.11, 0.10, 0.09, 0.10, 0.10};

        double p = test.pValue(candidate, baseline);

        assertTrue(p > 0.05, "p=" + p);
    }

    @Test
    void zeroVarianceOfDifferences_shouldGivePOne() {
        double[] candidate = {0.09, 0.09, 0.09};
        double[] baseline = {0.10, 0.10, 0.10};

        assertEquals(1.0, test.pValue(candidate, baseline));
    }

    @Test
    void tooFewPairs_shouldGivePOne() {
        assertEquals(1.0, test.pValue(new double[]{0.1}, new double[]{0.2}));
    }

    @Test
    void differentLengths_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> test.pValue(new double[]{0.1, 0.2}, new double[]{0.2}));
    }
}
