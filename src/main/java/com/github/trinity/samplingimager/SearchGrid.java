package com.github.trinity.samplingimager;

/**
 * Ordered candidate points at which the presence of the scatterer is tested.
 * The order of the grid is the order of every output field.
 *
 * @author Sean Phillips
 */
public final class SearchGrid {

    private final double[][] points;

    public SearchGrid(double[][] points) {
        this.points = ImagingHelper.copyPoints(points, "SearchGrid");
    }

    public int size() {
        return points.length;
    }

    public int dimension() {
        return points[0].length;
    }

    public double[] get(int index) {
        return points[index].clone();
    }

    /**
     * @return index of the grid point closest to {@code point}, ties resolved to the lowest index
     */
    public int nearestIndex(double[] point) {
        if (point.length != dimension()) {
            throw new DimensionMismatchException("query point dimension", dimension(), point.length);
        }
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int i = 0; i < points.length; i++) {
            double d = ImagingHelper.squaredEuclideanDistance(points[i], point);
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }
}
