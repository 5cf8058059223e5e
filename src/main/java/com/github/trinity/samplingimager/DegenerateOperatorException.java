package com.github.trinity.samplingimager;

/**
 * Raised when the windowing configuration leaves the data operator unusable:
 * an empty time window, an all-zero column, or a receiver with no signal left.
 *
 * @author Sean Phillips
 */
public class DegenerateOperatorException extends ImagingException {

    private final String dimension;
    private final int index;

    public DegenerateOperatorException(String dimension, int index, String message) {
        super(String.format("Degenerate operator (%s %d): %s", dimension, index, message));
        this.dimension = dimension;
        this.index = index;
    }

    /**
     * @return "window", "column" or "receiver"
     */
    public String getDimension() {
        return dimension;
    }

    public int getIndex() {
        return index;
    }
}
