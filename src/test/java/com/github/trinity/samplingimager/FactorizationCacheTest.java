package com.github.trinity.samplingimager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FactorizationCache")
class FactorizationCacheTest {

    private final RegularizedInverter inverter = new RegularizedInverter();
    private SignalOperator signalOperator;
    private DataVolume data;
    private FactorizationCache cache;

    @BeforeEach
    void setUp() {
        ReceiverSet receivers = SyntheticScene.receivers();
        signalOperator = new SignalOperator(receivers, SyntheticScene.timeAxis());
        data = SyntheticScene.dataFor(receivers, SyntheticScene.grid(), 12, 1.0);
        cache = new FactorizationCache();
    }

    @Test
    @DisplayName("same data and equal windowing reuse the factorization")
    void testReuse() {
        assertFalse(cache.isValid());
        SvdFactorization first = cache.obtain(signalOperator, data, WindowingConfig.defaults(), inverter);
        SvdFactorization second = cache.obtain(signalOperator, data, WindowingConfig.builder().build(), inverter);
        assertSame(first, second);
        assertSame(first, cache.current());
    }

    @Test
    @DisplayName("changed windowing or data rebuilds the factorization")
    void testRebuild() {
        SvdFactorization first = cache.obtain(signalOperator, data, WindowingConfig.defaults(), inverter);
        SvdFactorization shifted = cache.obtain(signalOperator, data,
            WindowingConfig.builder().timeShifts(3).build(), inverter);
        assertNotSame(first, shifted);
        assertEquals(3, shifted.columnCount());

        DataVolume other = SyntheticScene.dataFor(SyntheticScene.receivers(), SyntheticScene.grid(), 12, 1.0);
        SvdFactorization rebuilt = cache.obtain(signalOperator, other,
            WindowingConfig.builder().timeShifts(3).build(), inverter);
        assertNotSame(shifted, rebuilt);
    }

    @Test
    @DisplayName("invalidate drops the cached factorization")
    void testInvalidate() {
        cache.obtain(signalOperator, data, WindowingConfig.defaults(), inverter);
        cache.invalidate();
        assertFalse(cache.isValid());
        assertNull(cache.current());
    }

    @Test
    @DisplayName("a failed build leaves the cache empty")
    void testFailedBuild() {
        cache.obtain(signalOperator, data, WindowingConfig.defaults(), inverter);
        assertThrows(DegenerateOperatorException.class, () -> cache.obtain(signalOperator, data,
            WindowingConfig.builder().noiseFloor(100.0).build(), inverter));
        assertFalse(cache.isValid());
    }
}
