package com.github.trinity.samplingimager;

import java.util.Arrays;

/**
 * Small array utilities shared by the data model and the solver.
 *
 * @author Sean Phillips
 */
public final class ImagingHelper {

    private ImagingHelper() {
    }

    public static double euclideanDistance(double[] a, double[] b) {
        return Math.sqrt(squaredEuclideanDistance(a, b));
    }

    public static double squaredEuclideanDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    public static double[][] deepCopy(double[][] original) {
        double[][] copy = new double[original.length][];
        for (int i = 0; i < original.length; i++) {
            copy[i] = Arrays.copyOf(original[i], original[i].length);
        }
        return copy;
    }

    /**
     * Copies a rectangular volume, rejecting ragged or non-finite input.
     *
     * @param volume the [a][b][c] volume to copy
     * @param name   used in error messages
     * @return a deep copy of the volume
     */
    public static double[][][] copyRectangular(double[][][] volume, String name) {
        if (volume == null || volume.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        int b = volume[0].length;
        if (b == 0 || volume[0][0].length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        int c = volume[0][0].length;
        double[][][] copy = new double[volume.length][b][];
        for (int i = 0; i < volume.length; i++) {
            if (volume[i].length != b) {
                throw new IllegalArgumentException(name + " is ragged at index " + i);
            }
            for (int j = 0; j < b; j++) {
                if (volume[i][j].length != c) {
                    throw new IllegalArgumentException(name + " is ragged at index [" + i + "][" + j + "]");
                }
                for (int k = 0; k < c; k++) {
                    if (!Double.isFinite(volume[i][j][k])) {
                        throw new IllegalArgumentException(
                            name + " has a non-finite value at [" + i + "][" + j + "][" + k + "]");
                    }
                }
                copy[i][j] = Arrays.copyOf(volume[i][j], c);
            }
        }
        return copy;
    }

    /**
     * Validates and copies a list of 2-D or 3-D points sharing one dimension.
     */
    public static double[][] copyPoints(double[][] points, String name) {
        if (points == null || points.length == 0) {
            throw new IllegalArgumentException(name + " must contain at least one point");
        }
        int dim = points[0].length;
        if (dim != 2 && dim != 3) {
            throw new IllegalArgumentException(name + " points must be 2-D or 3-D, got " + dim);
        }
        for (int i = 0; i < points.length; i++) {
            if (points[i].length != dim) {
                throw new IllegalArgumentException(name + " point " + i + " has dimension "
                    + points[i].length + ", expected " + dim);
            }
            for (double x : points[i]) {
                if (!Double.isFinite(x)) {
                    throw new IllegalArgumentException(name + " point " + i + " is not finite");
                }
            }
        }
        return deepCopy(points);
    }

    public static int nextPowerOfTwo(int n) {
        int p = 1;
        while (p < n) {
            p <<= 1;
        }
        return p;
    }
}
