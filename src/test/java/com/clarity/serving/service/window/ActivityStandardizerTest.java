package com.clarity.serving.service.window;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActivityStandardizerTest {

    private ActivityStandardizer standardizer;

    @BeforeEach
    void setUp() {
        standardizer = new ActivityStandardizer();
    }

    @Test
    @DisplayName("Output has zero mean and unit variance")
    void testStandardize() {
        float[] result = standardizer.standardize(new float[]{2.0f, 4.0f, 4.0f, 4.0f, 5.0f, 5.0f, 7.0f, 9.0f});

        // mean 5, population std 2
        assertEquals(-1.5f, result[0], 1e-6f);
        assertEquals(0.0f, result[4], 1e-6f);
        assertEquals(2.0f, result[7], 1e-6f);
    }

    @Test
    @DisplayName("Non-finite values are ignored for statistics and kept in place")
    void testNonFiniteValuesKept() {
        float[] result = standardizer.standardize(new float[]{1.0f, Float.NaN, 3.0f});

        assertEquals(-1.0f, result[0], 1e-6f);
        assertTrue(Float.isNaN(result[1]));
        assertEquals(1.0f, result[2], 1e-6f);
    }

    @Test
    @DisplayName("Constant and tiny inputs come back unchanged")
    void testDegenerateInput() {
        float[] constant = {3.0f, 3.0f, 3.0f};
        float[] result = standardizer.standardize(constant);
        assertArrayEquals(constant, result);
        assertNotSame(constant, result);

        assertArrayEquals(new float[]{8.0f}, standardizer.standardize(new float[]{8.0f}));
        assertEquals(0, standardizer.standardize(new float[0]).length);
    }
}
