package com.github.trinity.samplingimager;

/**
 * Outcome of one regularized solve.
 *
 * @author Sean Phillips
 */
public enum SolveStatus {
    /** At least one singular component was retained. */
    OK,
    /** Every singular value fell below the floor; the solution is the zero vector. */
    ILL_CONDITIONED,
    /** The right-hand side was identically zero. */
    ZERO_RHS
}
