package com.weatherline.backend.correlation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsTest {

    @Test
    void shouldComputePerfectPositiveCorrelation() {
        double r = Statistics.pearson(new double[] {1, 2, 3, 4, 5}, new double[] {2, 4, 6, 8, 10});

        assertEquals(1.0, r, 1e-12);
    }

    @Test
    void shouldComputeKnownCorrelation() {
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 1, 4, 3, 5};

        assertEquals(0.8, Statistics.pearson(x, y), 1e-12);
    }

    @Test
    void shouldReturnNaNForConstantSeries() {
        assertTrue(Double.isNaN(Statistics.pearson(new double[] {3, 3, 3}, new double[] {1, 2, 3})));
    }

    @Test
    void shouldRejectSeriesOfDifferentLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> Statistics.pearson(new double[] {1, 2}, new double[] {1, 2, 3}));
    }

    @Test
    void shouldComputePValueAtSignificanceBoundary() {
        // Critical r for alpha 0.05 with 8 degrees of freedom
        assertEquals(0.05, Statistics.correlationPValue(0.6319, 10), 5e-4);
    }

    @Test
    void shouldComputePValueForModerateCorrelation() {
        // t = 0.5 * sqrt(28 / 0.75) = 3.055, df 28
        assertEquals(0.0049, Statistics.correlationPValue(0.5, 30), 5e-4);
    }

    @Test
    void shouldReturnUnitPValueForZeroCorrelation() {
        assertEquals(1.0, Statistics.correlationPValue(0.0, 20), 1e-9);
    }

    @Test
    void shouldReturnZeroPValueForPerfectCorrelation() {
        assertEquals(0.0, Statistics.correlationPValue(1.0, 10), 0.0);
    }

    @Test
    void shouldComputeFisherConfidenceInterval() {
        double[] interval = Statistics.correlationConfidenceInterval(0.5, 28);

        // z = 0.5493, se = 0.2
        assertEquals(Math.tanh(0.549306 - 1.959964 * 0.2), interval[0], 1e-5);
        assertEquals(Math.tanh(0.549306 + 1.959964 * 0.2), interval[1], 1e-5);
        assertTrue(interval[0] < 0.5 && interval[1] > 0.5);
    }

    @Test
    void shouldDegenerateConfidenceIntervalForTinySamples() {
        assertArrayEquals(new double[] {0.4, 0.4}, Statistics.correlationConfidenceInterval(0.4, 3), 0.0);
        assertArrayEquals(new double[] {1.0, 1.0}, Statistics.correlationConfidenceInterval(1.0, 50), 0.0);
    }

    @Test
    void shouldUseSampleStandardDeviation() {
        assertEquals(Math.sqrt(2.5), Statistics.standardDeviation(new double[] {1, 2, 3, 4, 5}), 1e-12);
        assertTrue(Double.isNaN(Statistics.standardDeviation(new double[] {1})));
    }
}
