package com.github.trinity.samplingimager;

/**
 * Ordered, immutable receiver coordinates (2-D or 3-D).
 *
 * @author Sean Phillips
 */
public final class ReceiverSet {

    private final double[][] coordinates;

    public ReceiverSet(double[][] coordinates) {
        this.coordinates = ImagingHelper.copyPoints(coordinates, "ReceiverSet");
    }

    public int size() {
        return coordinates.length;
    }

    public int dimension() {
        return coordinates[0].length;
    }

    public double[] get(int index) {
        return coordinates[index].clone();
    }
}
