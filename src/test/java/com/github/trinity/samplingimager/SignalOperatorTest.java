package com.github.trinity.samplingimager;

import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SignalOperator")
class SignalOperatorTest {

    private static final ReceiverSet RECEIVERS = SyntheticScene.receivers();
    private static final SearchGrid GRID = SyntheticScene.grid();
    private static final TimeAxis TIME = SyntheticScene.timeAxis();

    private static SignalOperator signalOperator() {
        return new SignalOperator(RECEIVERS, TIME);
    }

    @Nested
    @DisplayName("Shape validation")
    class ShapeTests {

        @Test
        @DisplayName("receiver count mismatch is rejected")
        void testReceiverMismatch() {
            DataVolume data = new DataVolume(new double[RECEIVERS.size() - 1][TIME.size()][1]);
            DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> signalOperator().build(data, WindowingConfig.defaults()));
            assertEquals(RECEIVERS.size(), e.getExpected());
            assertEquals(RECEIVERS.size() - 1, e.getActual());
        }

        @Test
        @DisplayName("time sample mismatch is rejected")
        void testTimeMismatch() {
            DataVolume data = new DataVolume(new double[RECEIVERS.size()][TIME.size() + 3][1]);
            assertThrows(DimensionMismatchException.class,
                () -> signalOperator().build(data, WindowingConfig.defaults()));
        }
    }

    @Nested
    @DisplayName("Time domain")
    class TimeDomainTests {

        @Test
        @DisplayName("source-index formulation has receivers x samples rows and one column per source")
        void testSourceIndexShape() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            Operator op = signalOperator().build(data, WindowingConfig.defaults());
            assertEquals(RECEIVERS.size() * TIME.size(), op.getRowCount());
            assertEquals(1, op.getColumnCount());
            assertEquals(TIME.size(), op.rowsPerReceiver());
        }

        @Test
        @DisplayName("shift columns are causal delays of the data scaled by dt")
        void testShiftColumns() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 7, 2.0);
            WindowingConfig config = WindowingConfig.builder().timeShifts(4).build();
            RealMatrix A = signalOperator().build(data, config).getMatrix();
            assertEquals(4, A.getColumnDimension());
            double dt = TIME.meanStep();
            for (int r = 0; r < RECEIVERS.size(); r++) {
                for (int k = 0; k < 4; k++) {
                    for (int t = 0; t < TIME.size(); t++) {
                        double expected = t >= k ? data.get(r, t - k, 0) * dt : 0.0;
                        assertEquals(expected, A.getEntry(r * TIME.size() + t, k), 0.0);
                    }
                }
            }
        }

        @Test
        @DisplayName("time window keeps only samples inside [start, end]")
        void testTimeWindow() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            WindowingConfig config = WindowingConfig.builder().timeWindow(0.495, 1.505).build();
            Operator op = signalOperator().build(data, config);
            assertEquals(50, op.getWindowStart());
            assertEquals(101, op.getWindowLength());
            assertEquals(RECEIVERS.size() * 101, op.getRowCount());

            double[] rhs = op.testFunction(SyntheticScene.impulseResponses(RECEIVERS, GRID), 3);
            assertEquals(op.getRowCount(), rhs.length);
        }

        @Test
        @DisplayName("noise floor zeroes small samples")
        void testNoiseFloor() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            WindowingConfig config = WindowingConfig.builder().noiseFloor(0.5).build();
            RealMatrix A = signalOperator().build(data, config).getMatrix();
            double dt = TIME.meanStep();
            for (int r = 0; r < RECEIVERS.size(); r++) {
                for (int t = 0; t < TIME.size(); t++) {
                    double raw = data.get(r, t, 0);
                    double expected = Math.abs(raw) < 0.5 ? 0.0 : raw * dt;
                    assertEquals(expected, A.getEntry(r * TIME.size() + t, 0), 0.0);
                }
            }
        }

        @Test
        @DisplayName("identical inputs build bit-identical operators")
        void testDeterministic() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 21, 3.0);
            WindowingConfig config = WindowingConfig.builder().timeShifts(6).noiseFloor(1e-3).build();
            RealMatrix first = signalOperator().build(data, config).getMatrix();
            RealMatrix second = signalOperator().build(data, config).getMatrix();
            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Frequency domain")
    class FrequencyDomainTests {

        @Test
        @DisplayName("full band has the same singular values as the time domain when nothing wraps")
        void testFullBandIsometry() {
            // signal confined to the first half of the window, so neither domain truncates it
            double[][][] values = new double[2][64][1];
            for (int t = 0; t < 20; t++) {
                values[0][t][0] = Math.sin(0.3 * t) * Math.exp(-0.1 * t);
                values[1][t][0] = Math.cos(0.2 * t) * Math.exp(-0.05 * t);
            }
            SignalOperator so = new SignalOperator(new ReceiverSet(new double[][]{{0, 0}, {1, 0}}),
                TimeAxis.uniform(0.0, 0.5, 64));
            DataVolume data = new DataVolume(values);
            WindowingConfig time = WindowingConfig.builder().timeShifts(5).build();
            WindowingConfig freq = WindowingConfig.builder().timeShifts(5)
                .domain(WindowingConfig.Domain.FREQUENCY).build();

            RegularizedInverter inverter = new RegularizedInverter();
            double[] sTime = inverter.factorize(so.build(data, time)).getSingularValues();
            double[] sFreq = inverter.factorize(so.build(data, freq)).getSingularValues();
            assertEquals(sTime.length, sFreq.length);
            for (int i = 0; i < sTime.length; i++) {
                assertEquals(sTime[i], sFreq[i], 1e-9 * sTime[0]);
            }
        }

        @Test
        @DisplayName("band limit reduces the row count and keeps rhs layout consistent")
        void testBandLimit() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            Operator full = signalOperator().build(data,
                WindowingConfig.builder().domain(WindowingConfig.Domain.FREQUENCY).build());
            Operator band = signalOperator().build(data, WindowingConfig.builder()
                .domain(WindowingConfig.Domain.FREQUENCY).frequencyBand(0.0, 0.25).build());
            assertTrue(band.getRowCount() < full.getRowCount());
            double[] rhs = band.testFunction(SyntheticScene.impulseResponses(RECEIVERS, GRID), 0);
            assertEquals(band.getRowCount(), rhs.length);
        }

        @Test
        @DisplayName("a one-sample window keeps its DC and Nyquist bins")
        void testSingleSampleWindow() {
            SignalOperator so = new SignalOperator(new ReceiverSet(new double[][]{{0, 0}}),
                TimeAxis.uniform(0.0, 1.0, 4));
            DataVolume data = new DataVolume(new double[][][]{{{0.0}, {3.0}, {0.0}, {0.0}}});
            WindowingConfig time = WindowingConfig.builder().timeWindow(1.0, 1.0).build();
            WindowingConfig freq = WindowingConfig.builder().timeWindow(1.0, 1.0)
                .domain(WindowingConfig.Domain.FREQUENCY).build();

            Operator timeOp = so.build(data, time);
            Operator freqOp = so.build(data, freq);
            assertEquals(1, freqOp.getWindowLength());
            assertEquals(2, freqOp.getRowCount());
            assertEquals(1, freqOp.getColumnCount());

            RegularizedInverter inverter = new RegularizedInverter();
            assertEquals(inverter.factorize(timeOp).largestSingularValue(),
                inverter.factorize(freqOp).largestSingularValue(), 1e-12);
        }

        @Test
        @DisplayName("non-uniform time axis is rejected")
        void testNonUniformAxis() {
            double[] t = new double[TIME.size()];
            for (int i = 0; i < t.length; i++) {
                t[i] = i * i * 1e-3;
            }
            SignalOperator so = new SignalOperator(RECEIVERS, new TimeAxis(t));
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            assertThrows(IllegalArgumentException.class, () -> so.build(data,
                WindowingConfig.builder().domain(WindowingConfig.Domain.FREQUENCY).build()));
        }
    }

    @Nested
    @DisplayName("Degenerate configurations")
    class DegenerateTests {

        @Test
        @DisplayName("noise floor above every sample silences the receivers")
        void testSilentReceiver() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            DegenerateOperatorException e = assertThrows(DegenerateOperatorException.class,
                () -> signalOperator().build(data, WindowingConfig.builder().noiseFloor(10.0).build()));
            assertEquals("receiver", e.getDimension());
            assertEquals(0, e.getIndex());
        }

        @Test
        @DisplayName("an all-zero source yields a zero column")
        void testZeroColumn() {
            double[][][] values = new double[RECEIVERS.size()][TIME.size()][2];
            for (int r = 0; r < RECEIVERS.size(); r++) {
                values[r][10][0] = 1.0;
            }
            DegenerateOperatorException e = assertThrows(DegenerateOperatorException.class,
                () -> signalOperator().build(new DataVolume(values), WindowingConfig.defaults()));
            assertEquals("column", e.getDimension());
            assertEquals(1, e.getIndex());
        }

        @Test
        @DisplayName("a window outside the time axis is empty")
        void testEmptyWindow() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            DegenerateOperatorException e = assertThrows(DegenerateOperatorException.class,
                () -> signalOperator().build(data, WindowingConfig.builder().timeWindow(5.0, 6.0).build()));
            assertEquals("window", e.getDimension());
        }

        @Test
        @DisplayName("more shifts than window samples is rejected")
        void testTooManyShifts() {
            DataVolume data = SyntheticScene.dataFor(RECEIVERS, GRID, 12, 1.0);
            assertThrows(DegenerateOperatorException.class, () -> signalOperator().build(data,
                WindowingConfig.builder().timeWindow(0.0, 0.1).timeShifts(20).build()));
        }
    }

    @Test
    @DisplayName("invalid windowing options are rejected by the builder")
    void testInvalidWindowingConfig() {
        assertThrows(IllegalArgumentException.class, () -> WindowingConfig.builder().timeShifts(0).build());
        assertThrows(IllegalArgumentException.class, () -> WindowingConfig.builder().noiseFloor(-1).build());
        assertThrows(IllegalArgumentException.class, () -> WindowingConfig.builder().timeWindow(2, 1).build());
        assertThrows(IllegalArgumentException.class,
            () -> WindowingConfig.builder().frequencyBand(0.5, 0.5).build());
    }
}
