package com.github.trinity.samplingimager;

/**
 * Result of {@link RegularizedInverter#solve}.
 *
 * @author Sean Phillips
 */
public final class RegularizedSolution {

    private final double[] solution;
    private final double residualNorm;
    private final double parameter;
    private final double smallestRetained;
    private final int retainedRank;
    private final SolveStatus status;

    RegularizedSolution(double[] solution, double residualNorm, double parameter, double smallestRetained,
                        int retainedRank, SolveStatus status) {
        this.solution = solution;
        this.residualNorm = residualNorm;
        this.parameter = parameter;
        this.smallestRetained = smallestRetained;
        this.retainedRank = retainedRank;
        this.status = status;
    }

    public double[] getSolution() {
        return solution.clone();
    }

    public double solutionNorm() {
        return ImagingHelper.norm(solution);
    }

    /**
     * @return {@code ||A phi - b||}
     */
    public double getResidualNorm() {
        return residualNorm;
    }

    /**
     * @return the Tikhonov alpha when Tikhonov filtering was applied, otherwise the
     *         smallest retained singular value (0 if nothing was retained)
     */
    public double getParameter() {
        return parameter;
    }

    /**
     * @return smallest singular value that contributed to the solution, 0 if none
     */
    public double getSmallestRetained() {
        return smallestRetained;
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
}
