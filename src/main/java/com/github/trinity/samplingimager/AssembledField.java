package com.github.trinity.samplingimager;

/**
 * Indicator field and diagnostics produced by {@link ResultAssembler}.
 *
 * @author Sean Phillips
 */
public final class AssembledField {

    private final IndicatorField field;
    private final Diagnostics diagnostics;

    AssembledField(IndicatorField field, Diagnostics diagnostics) {
        this.field = field;
        this.diagnostics = diagnostics;
    }

    public IndicatorField getField() {
        return field;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
