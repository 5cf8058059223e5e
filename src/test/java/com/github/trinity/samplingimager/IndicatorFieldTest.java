package com.github.trinity.samplingimager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IndicatorField")
class IndicatorFieldTest {

    @Test
    @DisplayName("normalized field peaks at one")
    void testNormalized() {
        IndicatorField field = new IndicatorField(new double[]{1.0, 4.0, 2.0, 0.0});
        IndicatorField normalized = field.normalized();
        assertArrayEquals(new double[]{0.25, 1.0, 0.5, 0.0}, normalized.toArray(), 1e-15);
        assertEquals(1, field.argMax());
        assertEquals(4.0, field.max(), 0.0);
    }

    @Test
    @DisplayName("level set uses the normalized field and the default isolevel")
    void testLevelSet() {
        IndicatorField field = new IndicatorField(new double[]{1.0, 10.0, 7.0, 6.9, 8.5});
        assertEquals(List.of(1, 2, 4), field.levelSet());
        assertEquals(List.of(1), field.levelSet(0.9));
        assertEquals(List.of(0, 1, 2, 3, 4), field.levelSet(0.0));
        assertThrows(IllegalArgumentException.class, () -> field.levelSet(1.5));
    }

    @Test
    @DisplayName("an all-sentinel field normalizes to zeros and has an empty level set")
    void testAllSentinel() {
        IndicatorField field = new IndicatorField(new double[3]);
        assertArrayEquals(new double[3], field.normalized().toArray(), 0.0);
        assertTrue(field.levelSet().isEmpty());
    }

    @Test
    @DisplayName("values are copied in and out")
    void testImmutable() {
        double[] values = {1.0, 2.0};
        IndicatorField field = new IndicatorField(values);
        values[0] = 99.0;
        field.toArray()[1] = 99.0;
        assertEquals(1.0, field.get(0), 0.0);
        assertEquals(2.0, field.get(1), 0.0);
    }

    @Test
    @DisplayName("fields of different sizes cannot be compared")
    void testDifferenceSizeMismatch() {
        IndicatorField a = new IndicatorField(new double[]{1.0, 2.0});
        assertEquals(0.5, a.maxAbsDifference(new IndicatorField(new double[]{1.5, 2.0})), 0.0);
        assertThrows(DimensionMismatchException.class,
            () -> a.maxAbsDifference(new IndicatorField(new double[]{1.0})));
    }
}
