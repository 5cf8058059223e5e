package com.github.trinity.samplingimager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One indicator value per search-grid point, in grid order. Immutable.
 *
 * <p>
 * Larger values mean the point is more likely inside or near the scatterer.
 * {@link #normalized()} rescales to [0, 1], the range the visualization layer
 * thresholds. {@link #levelSet(double)} picks the points at or above an isolevel.
 * </p>
 *
 * @author Sean Phillips
 */
public final class IndicatorField {

    public static final double DEFAULT_ISOLEVEL = 0.7;

    private final double[] values;

    public IndicatorField(double[] values) {
        this.values = Arrays.copyOf(values, values.length);
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public double max() {
        return Arrays.stream(values).max().orElse(0.0);
    }

    public int argMax() {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    /**
     * Divides by the maximum so values fall in [0, 1]. An all-zero field stays zero.
     */
    public IndicatorField normalized() {
        double max = max();
        if (max <= 0.0) {
            return new IndicatorField(new double[values.length]);
        }
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] / max;
        }
        return new IndicatorField(scaled);
    }

    /**
     * @param isolevel threshold on the normalized field, in [0, 1]
     * @return grid indices whose normalized value is at least {@code isolevel}, ascending
     */
    public List<Integer> levelSet(double isolevel) {
        if (!(isolevel >= 0.0 && isolevel <= 1.0)) {
            throw new IllegalArgumentException("Isolevel must be in [0, 1], got " + isolevel);
        }
        double[] normalized = normalized().values;
        double max = max();
        List<Integer> inside = new ArrayList<>();
        if (max <= 0.0) {
            return inside;
        }
        for (int i = 0; i < normalized.length; i++) {
            if (normalized[i] >= isolevel) {
                inside.add(i);
            }
        }
        return inside;
    }

    public List<Integer> levelSet() {
        return levelSet(DEFAULT_ISOLEVEL);
    }

    /**
     * Largest absolute difference to another field of the same size.
     */
    public double maxAbsDifference(IndicatorField other) {
        if (other.size() != size()) {
            throw new DimensionMismatchException("indicator field size", size(), other.size());
        }
        double worst = 0.0;
        for (int i = 0; i < values.length; i++) {
            worst = Math.max(worst, Math.abs(values[i] - other.values[i]));
        }
        return worst;
    }
}
