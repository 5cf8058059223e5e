package com.github.trinity.samplingimager;

/**
 * Indicator value and diagnostics produced for one grid index.
 *
 * @author Sean Phillips
 */
public final class PointEvaluation {

    private final int index;
    private final double indicator;
    private final PointDiagnostics diagnostics;

    public PointEvaluation(int index, double indicator, PointDiagnostics diagnostics) {
        this.index = index;
        this.indicator = indicator;
        this.diagnostics = diagnostics;
    }

    public int getIndex() {
        return index;
    }

    public double getIndicator() {
        return indicator;
    }

    public PointDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
