package com.github.trinity.samplingimager;

/**
 * Everything an imaging run hands to the visualization layer.
 *
 * @author Sean Phillips
 */
public final class ImagingResult {

    private final IndicatorField field;
    private final Diagnostics diagnostics;
    private final double[] singularValues;
    private final WindowingConfig.Domain domain;
    private final RegularizationConfig regularization;

    ImagingResult(IndicatorField field, Diagnostics diagnostics, double[] singularValues,
                  WindowingConfig.Domain domain, RegularizationConfig regularization) {
        this.field = field;
        this.diagnostics = diagnostics;
        this.singularValues = singularValues.clone();
        this.domain = domain;
        this.regularization = regularization;
    }

    public IndicatorField getField() {
        return field;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return singular values of the data operator, decreasing
     */
    public double[] getSingularValues() {
        return singularValues.clone();
    }

    public WindowingConfig.Domain getDomain() {
        return domain;
    }

    public RegularizationConfig getRegularization() {
        return regularization;
    }
}
