package com.github.trinity.samplingimager;

/**
 * Recorded scattered-field measurements indexed (receiver, time, source).
 * The volume is copied on construction and never modified.
 *
 * @author Sean Phillips
 */
public final class DataVolume {

    private final double[][][] values;

    public DataVolume(double[][][] values) {
        this.values = ImagingHelper.copyRectangular(values, "DataVolume");
    }

    public int receivers() {
        return values.length;
    }

    public int timeSamples() {
        return values[0].length;
    }

    public int sources() {
        return values[0][0].length;
    }

    public double get(int receiver, int time, int source) {
        return values[receiver][time][source];
    }
}
