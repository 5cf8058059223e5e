package com.github.trinity.samplingimager;

/**
 * Raised when two inputs disagree on an extent, e.g. a data volume with more
 * receivers than the receiver set. Always raised before any numerical work.
 *
 * @author Sean Phillips
 */
public class DimensionMismatchException extends ImagingException {

    private final String what;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(String.format("Dimension mismatch for %s: expected %d but was %d", what, expected, actual));
        this.what = what;
        this.expected = expected;
        this.actual = actual;
    }

    public String getWhat() {
        return what;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
