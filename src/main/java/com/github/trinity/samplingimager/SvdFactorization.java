package com.github.trinity.samplingimager;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Thin singular value decomposition {@code A = U S V^T} of an {@link Operator},
 * singular values in decreasing order. Immutable and safe to share between
 * workers.
 *
 * @author Sean Phillips
 */
public final class SvdFactorization {

    private final Operator operator;
    private final double[][] u;
    private final double[] singularValues;
    private final double[][] v;

    SvdFactorization(Operator operator, RealMatrix u, double[] singularValues, RealMatrix v) {
        this.operator = operator;
        // row-major copies: the solver reads U by column and V by column, both through plain arrays
        this.u = u.transpose().getData();
        this.singularValues = singularValues.clone();
        this.v = v.transpose().getData();
    }

    public Operator getOperator() {
        return operator;
    }

    public int rank() {
        return singularValues.length;
    }

    public double[] getSingularValues() {
        return singularValues.clone();
    }

    public double singularValue(int i) {
        return singularValues[i];
    }

    public double largestSingularValue() {
        return singularValues.length == 0 ? 0.0 : singularValues[0];
    }

    /**
     * 2-norm condition number over all singular values (infinite when the smallest is 0).
     */
    public double conditionNumber() {
        double smallest = singularValues[singularValues.length - 1];
        return smallest == 0.0 ? Double.POSITIVE_INFINITY : singularValues[0] / smallest;
    }

    // i-th left singular vector (length = operator rows); not copied
    double[] leftVector(int i) {
        return u[i];
    }

    // i-th right singular vector (length = operator columns); not copied
    double[] rightVector(int i) {
        return v[i];
    }

    public int rowCount() {
        return operator.getRowCount();
    }

    public int columnCount() {
        return operator.getColumnCount();
    }
}
