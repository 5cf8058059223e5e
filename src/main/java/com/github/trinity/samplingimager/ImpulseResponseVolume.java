package com.github.trinity.samplingimager;

/**
 * Simulated host-medium responses indexed (receiver, time, grid point): the
 * field recorded at each receiver when a unit source sits at a search-grid point.
 *
 * @author Sean Phillips
 */
public final class ImpulseResponseVolume {

    private final double[][][] values;

    public ImpulseResponseVolume(double[][][] values) {
        this.values = ImagingHelper.copyRectangular(values, "ImpulseResponseVolume");
    }

    public int receivers() {
        return values.length;
    }

    public int timeSamples() {
        return values[0].length;
    }

    public int gridPoints() {
        return values[0][0].length;
    }

    public double get(int receiver, int time, int gridPoint) {
        return values[receiver][time][gridPoint];
    }

    /**
     * @return the trace of {@code gridPoint} at {@code receiver}, as a new array
     */
    public double[] trace(int receiver, int gridPoint) {
        double[] trace = new double[values[receiver].length];
        for (int t = 0; t < trace.length; t++) {
            trace[t] = values[receiver][t][gridPoint];
        }
        return trace;
    }
}
