package com.github.trinity.samplingimager;

/**
 * Configuration controlling how the regularized pseudo-solution is formed for
 * each right-hand side.
 *
 * <ul>
 *   <li><b>truncation</b>: which singular components may contribute. {@code FIXED_RANK}
 *       keeps the first {@code rank}; {@code RELATIVE_THRESHOLD} keeps those with
 *       {@code sigma_i >= ratio * sigma_1}; {@code NONE} keeps all.</li>
 *   <li><b>tikhonov</b>: filter applied to the retained components. {@code FIXED} uses
 *       {@code alpha}; {@code MOROZOV} picks alpha per right-hand side so that the
 *       residual over the truncated components equals {@code noiseLevel * ||b||}
 *       (discrepancy principle). The floor plays no part in choosing alpha.</li>
 *   <li><b>singularValueFloor</b>: absolute floor. Components with {@code sigma_i <= floor}
 *       are discarded whatever the other rules say.</li>
 *   <li><b>indicator</b>: how the solution is reduced to one indicator value.</li>
 *   <li><b>maxEvaluations / discrepancyTolerance</b>: evaluation budget of the
 *       discrepancy-principle root search, and its absolute accuracy on {@code log(alpha)}.</li>
 * </ul>
 *
 * <p>
 * Defaults: relative truncation at 1e-3, no Tikhonov filter, floor 0, indicator
 * {@code 1 / ||phi||}.
 * </p>
 *
 * @author Sean Phillips
 */
public final class RegularizationConfig {

    public enum TruncationRule {
        NONE,
        FIXED_RANK,
        RELATIVE_THRESHOLD
    }

    public enum TikhonovSource {
        NONE,
        FIXED,
        MOROZOV
    }

    /**
     * Reduction of the regularized solution to a scalar. In both conventions a
     * larger value means the sampling point is more likely inside the scatterer.
     */
    public enum IndicatorFunctional {
        /** {@code 1 / ||phi||}. */
        INVERSE_SOLUTION_NORM,
        /** {@code 1 / (||A phi - b||^2 + a ||phi||^2)}, the regularized functional at its minimizer. */
        INVERSE_TIKHONOV_FUNCTIONAL
    }

    private final TruncationRule truncation;
    private final int rank;
    private final double ratio;
    private final TikhonovSource tikhonov;
    private final double alpha;
    private final double noiseLevel;
    private final double singularValueFloor;
    private final IndicatorFunctional indicator;
    private final int maxEvaluations;
    private final double discrepancyTolerance;

    private RegularizationConfig(Builder builder) {
        this.truncation = builder.truncation;
        this.rank = builder.rank;
        this.ratio = builder.ratio;
        this.tikhonov = builder.tikhonov;
        this.alpha = builder.alpha;
        this.noiseLevel = builder.noiseLevel;
        this.singularValueFloor = builder.singularValueFloor;
        this.indicator = builder.indicator;
        this.maxEvaluations = builder.maxEvaluations;
        this.discrepancyTolerance = builder.discrepancyTolerance;
    }

    public static RegularizationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TruncationRule getTruncation() {
        return truncation;
    }

    public int getRank() {
        return rank;
    }

    public double getRatio() {
        return ratio;
    }

    public TikhonovSource getTikhonov() {
        return tikhonov;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getNoiseLevel() {
        return noiseLevel;
    }

    public double getSingularValueFloor() {
        return singularValueFloor;
    }

    public IndicatorFunctional getIndicator() {
        return indicator;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    public double getDiscrepancyTolerance() {
        return discrepancyTolerance;
    }

    /**
     * Copy of this configuration with a different singular-value floor.
     */
    public RegularizationConfig withSingularValueFloor(double floor) {
        return toBuilder().singularValueFloor(floor).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.truncation = truncation;
        b.rank = rank;
        b.ratio = ratio;
        b.tikhonov = tikhonov;
        b.alpha = alpha;
        b.noiseLevel = noiseLevel;
        b.singularValueFloor = singularValueFloor;
        b.indicator = indicator;
        b.maxEvaluations = maxEvaluations;
        b.discrepancyTolerance = discrepancyTolerance;
        return b;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RegularizationConfig[");
        switch (truncation) {
            case FIXED_RANK -> sb.append("rank=").append(rank);
            case RELATIVE_THRESHOLD -> sb.append("ratio=").append(ratio);
            default -> sb.append("no truncation");
        }
        switch (tikhonov) {
            case FIXED -> sb.append(", alpha=").append(alpha);
            case MOROZOV -> sb.append(", morozov delta=").append(noiseLevel);
            default -> {
            }
        }
        return sb.append(", floor=").append(singularValueFloor)
            .append(", indicator=").append(indicator).append(']').toString();
    }

    public static final class Builder {
        private TruncationRule truncation = TruncationRule.RELATIVE_THRESHOLD;
        private int rank = 0;
        private double ratio = 1e-3;
        private TikhonovSource tikhonov = TikhonovSource.NONE;
        private double alpha = 0.0;
        private double noiseLevel = 0.0;
        private double singularValueFloor = 0.0;
        private IndicatorFunctional indicator = IndicatorFunctional.INVERSE_SOLUTION_NORM;
        private int maxEvaluations = 200;
        private double discrepancyTolerance = 1e-8;

        private Builder() {
        }

        public Builder noTruncation() {
            this.truncation = TruncationRule.NONE;
            return this;
        }

        public Builder fixedRank(int rank) {
            this.truncation = TruncationRule.FIXED_RANK;
            this.rank = rank;
            return this;
        }

        public Builder relativeThreshold(double ratio) {
            this.truncation = TruncationRule.RELATIVE_THRESHOLD;
            this.ratio = ratio;
            return this;
        }

        public Builder noTikhonov() {
            this.tikhonov = TikhonovSource.NONE;
            return this;
        }

        public Builder tikhonov(double alpha) {
            this.tikhonov = TikhonovSource.FIXED;
            this.alpha = alpha;
            return this;
        }

        public Builder morozov(double noiseLevel) {
            this.tikhonov = TikhonovSource.MOROZOV;
            this.noiseLevel = noiseLevel;
            return this;
        }

        public Builder singularValueFloor(double floor) {
            this.singularValueFloor = floor;
            return this;
        }

        public Builder indicator(IndicatorFunctional indicator) {
            this.indicator = indicator;
            return this;
        }

        public Builder maxEvaluations(int maxEvaluations) {
            this.maxEvaluations = maxEvaluations;
            return this;
        }

        public Builder discrepancyTolerance(double tolerance) {
            this.discrepancyTolerance = tolerance;
            return this;
        }

        public RegularizationConfig build() {
            if (truncation == null || tikhonov == null || indicator == null) {
                throw new IllegalArgumentException("Truncation, Tikhonov source and indicator must be set");
            }
            if (truncation == TruncationRule.FIXED_RANK && rank < 1) {
                throw new IllegalArgumentException("Fixed rank must be >= 1, got " + rank);
            }
            if (truncation == TruncationRule.RELATIVE_THRESHOLD && !(ratio > 0.0 && ratio <= 1.0)) {
                throw new IllegalArgumentException("Relative threshold must be in (0, 1], got " + ratio);
            }
            if (tikhonov == TikhonovSource.FIXED && !(alpha > 0.0 && Double.isFinite(alpha))) {
                throw new IllegalArgumentException("Tikhonov alpha must be finite and > 0, got " + alpha);
            }
            if (tikhonov == TikhonovSource.MOROZOV && !(noiseLevel > 0.0 && noiseLevel < 1.0)) {
                throw new IllegalArgumentException("Morozov noise level must be in (0, 1), got " + noiseLevel);
            }
            if (!(singularValueFloor >= 0.0) || Double.isInfinite(singularValueFloor)) {
                throw new IllegalArgumentException("Singular value floor must be finite and >= 0, got "
                    + singularValueFloor);
            }
            if (maxEvaluations < 1) {
                throw new IllegalArgumentException("Max evaluations must be >= 1, got " + maxEvaluations);
            }
            if (!(discrepancyTolerance > 0.0)) {
                throw new IllegalArgumentException("Discrepancy tolerance must be > 0, got " + discrepancyTolerance);
            }
            return new RegularizationConfig(this);
        }
    }
}
