package com.sensorplatform.common.descriptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearFitTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("exact line against index → slope, intercept, R² = 1")
    void exactLine() {
        LinearFit fit = LinearFit.ofIndex(new double[]{3.0, 5.0, 7.0, 9.0, 11.0});
        assertEquals(2.0, fit.slope(), EPS);
        assertEquals(3.0, fit.intercept(), EPS);
        assertEquals(1.0, fit.rSquared(), EPS);
        assertEquals(13.0, fit.valueAt(5), EPS);
    }

    @Test
    @DisplayName("window fit uses local index 0..length-1")
    void windowFit() {
        double[] y = {100.0, 100.0, 1.0, 2.0, 3.0, 100.0};
        LinearFit fit = LinearFit.ofIndex(y, 2, 3);
        assertEquals(1.0, fit.slope(), EPS);
        assertEquals(1.0, fit.intercept(), EPS);
    }

    @Test
    @DisplayName("constant y → slope 0, R² 0")
    void constantY() {
        LinearFit fit = LinearFit.of(new double[]{1, 2, 3}, new double[]{4, 4, 4});
        assertEquals(0.0, fit.slope(), EPS);
        assertEquals(4.0, fit.intercept(), EPS);
        assertEquals(0.0, fit.rSquared(), EPS);
    }

    @Test
    @DisplayName("degenerate x → flat line through mean y")
    void degenerateX() {
        LinearFit fit = LinearFit.of(new double[]{2, 2, 2}, new double[]{1, 2, 3});
        assertEquals(0.0, fit.slope(), EPS);
        assertEquals(2.0, fit.intercept(), EPS);
    }

    @Test
    @DisplayName("mismatched lengths are rejected")
    void mismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
            () -> LinearFit.of(new double[]{1, 2}, new double[]{1}));
    }

    @Test
    @DisplayName("single point → zero slope through that point")
    void singlePoint() {
        LinearFit fit = LinearFit.ofIndex(new double[]{7.5});
        assertEquals(0.0, fit.slope(), EPS);
        assertEquals(7.5, fit.intercept(), EPS);
    }
}
