package com.github.trinity.samplingimager;

/**
 * Auxiliary values recorded for one grid point.
 *
 * @author Sean Phillips
 */
public final class PointDiagnostics {

    private final double conditionNumber;
    private final double regularizationParameter;
    private final double residualNorm;
    private final double solutionNorm;
    private final int retainedRank;
    private final SolveStatus status;

    public PointDiagnostics(double conditionNumber, double regularizationParameter, double residualNorm,
                            double solutionNorm, int retainedRank, SolveStatus status) {
        this.conditionNumber = conditionNumber;
        this.regularizationParameter = regularizationParameter;
        this.residualNorm = residualNorm;
        this.solutionNorm = solutionNorm;
        this.retainedRank = retainedRank;
        this.status = status;
    }

    /**
     * Effective condition number {@code sigma_1 / sigma_k} over the retained components
     * (infinite when nothing was retained).
     */
    public double getConditionNumber() {
        return conditionNumber;
    }

    public double getRegularizationParameter() {
        return regularizationParameter;
    }

    /**
     * Residual of the unit-normalized test function.
     */
    public double getResidualNorm() {
        return residualNorm;
    }

    public double getSolutionNorm() {
        return solutionNorm;
    }

    public int getRetainedRank() {
        return retainedRank;
    }

    public SolveStatus getStatus() {
        return status;
    }

    public boolean isIllConditioned() {
        return status == SolveStatus.ILL_CONDITIONED;
    }

    @Override
    public String toString() {
        return String.format("PointDiagnostics[status=%s, rank=%d, cond=%.3e, param=%.3e, residual=%.3e, |phi|=%.3e]",
            status, retainedRank, conditionNumber, regularizationParameter, residualNorm, solutionNorm);
    }
}
