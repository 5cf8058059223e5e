package com.github.trinity.samplingimager;

import java.util.Arrays;

/**
 * Strictly increasing time samples shared by the recorded data and the impulse
 * responses. Spacing may be non-uniform.
 *
 * @author Sean Phillips
 */
public final class TimeAxis {

    private static final double UNIFORM_TOLERANCE = 1e-9;

    private final double[] samples;

    public TimeAxis(double[] samples) {
        if (samples == null || samples.length < 2) {
            throw new IllegalArgumentException("TimeAxis needs at least two samples");
        }
        for (int i = 0; i < samples.length; i++) {
            if (!Double.isFinite(samples[i])) {
                throw new IllegalArgumentException("TimeAxis sample " + i + " is not finite");
            }
            if (i > 0 && samples[i] <= samples[i - 1]) {
                throw new IllegalArgumentException("TimeAxis must be strictly increasing at sample " + i);
            }
        }
        this.samples = Arrays.copyOf(samples, samples.length);
    }

    /**
     * Uniformly spaced axis {@code start, start + step, ...}.
     */
    public static TimeAxis uniform(double start, double step, int count) {
        double[] t = new double[count];
        for (int i = 0; i < count; i++) {
            t[i] = start + i * step;
        }
        return new TimeAxis(t);
    }

    public int size() {
        return samples.length;
    }

    public double get(int index) {
        return samples[index];
    }

    public double first() {
        return samples[0];
    }

    public double last() {
        return samples[samples.length - 1];
    }

    public double meanStep() {
        return (last() - first()) / (samples.length - 1);
    }

    public boolean isUniform() {
        double step = meanStep();
        for (int i = 1; i < samples.length; i++) {
            if (Math.abs(samples[i] - samples[i - 1] - step) > UNIFORM_TOLERANCE * Math.abs(step)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return first sample index whose time is at or after {@code time}, or {@link #size()} if none
     */
    public int indexAtOrAfter(double time) {
        int idx = Arrays.binarySearch(samples, time);
        return idx >= 0 ? idx : -idx - 1;
    }

    /**
     * @return last sample index whose time is at or before {@code time}, or -1 if none
     */
    public int indexAtOrBefore(double time) {
        int idx = Arrays.binarySearch(samples, time);
        return idx >= 0 ? idx : -idx - 2;
    }
}
