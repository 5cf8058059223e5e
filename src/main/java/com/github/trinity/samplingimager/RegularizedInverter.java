package com.github.trinity.samplingimager;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regularized inversion of the data operator through its singular value
 * decomposition.
 *
 * <p>
 * The factorization is computed once per operator ({@link #factorize}); every
 * right-hand side is then solved in {@code O(p (m + n))} by {@link #solve}. With
 * {@code c_i = u_i^T b} the regularized solution is
 * </p>
 * <pre>
 * phi = sum_{i in I} f_i * c_i / sigma_i * v_i
 * </pre>
 * <p>
 * where {@code I} holds the components allowed by the truncation rule whose
 * singular value lies strictly above the floor, and {@code f_i = 1} (truncated SVD)
 * or {@code f_i = sigma_i^2 / (sigma_i^2 + alpha)} (Tikhonov). Components below
 * the floor never enter a division.
 * </p>
 *
 * <p>
 * Instances hold no state and may be shared between threads.
 * </p>
 *
 * @author Sean Phillips
 */
public class RegularizedInverter {
    private static final Logger LOG = LoggerFactory.getLogger(RegularizedInverter.class);

    static final double MIN_ALPHA_FACTOR = 1e-16;
    static final double MAX_ALPHA_FACTOR = 1e4;

    /**
     * Computes the thin SVD of the operator. This is the one expensive step of an
     * imaging run and must not be repeated per grid point.
     */
    public SvdFactorization factorize(Operator operator) {
        long start = System.nanoTime();
        SingularValueDecomposition svd = new SingularValueDecomposition(operator.matrixView());
        SvdFactorization factorization = new SvdFactorization(operator, svd.getU(), svd.getSingularValues(),
            svd.getV());
        LOG.info("Factorized {} x {} operator in {} ms: sigma_max = {}, condition number = {}",
            operator.getRowCount(), operator.getColumnCount(), (System.nanoTime() - start) / 1_000_000,
            String.format("%.6e", factorization.largestSingularValue()),
            String.format("%.6e", factorization.conditionNumber()));
        return factorization;
    }

    /**
     * Regularized pseudo-solution of {@code A phi = rhs}.
     *
     * @param factorization SVD of the operator
     * @param rhs           right-hand side, length = operator rows
     * @param config        truncation, filter and floor
     * @return the solution with its residual, the parameter used and the retained rank;
     *         status {@link SolveStatus#ILL_CONDITIONED} with a zero solution when every
     *         singular value is at or below the floor
     * @throws DimensionMismatchException if the rhs length does not match the operator
     */
    public RegularizedSolution solve(SvdFactorization factorization, double[] rhs, RegularizationConfig config) {
        int m = factorization.rowCount();
        int n = factorization.columnCount();
        if (rhs.length != m) {
            throw new DimensionMismatchException("right-hand side length", m, rhs.length);
        }
        double rhsNormSq = ImagingHelper.dot(rhs, rhs);
        if (rhsNormSq == 0.0) {
            return new RegularizedSolution(new double[n], 0.0, 0.0, 0.0, 0, SolveStatus.ZERO_RHS);
        }

        int kept = retainedRank(factorization, config);
        if (kept == 0) {
            LOG.debug("All {} singular values at or below floor {}; returning zero solution",
                factorization.rank(), config.getSingularValueFloor());
            return new RegularizedSolution(new double[n], Math.sqrt(rhsNormSq), 0.0, 0.0, 0,
                SolveStatus.ILL_CONDITIONED);
        }

        double alpha;
        switch (config.getTikhonov()) {
            case FIXED -> alpha = config.getAlpha();
            case MOROZOV -> alpha = morozovAlpha(factorization, rhs, rhsNormSq, config);
            default -> alpha = 0.0;
        }

        double[] sigma = new double[kept];
        double[] coefficients = new double[kept];
        double capturedSq = 0.0;
        for (int i = 0; i < kept; i++) {
            sigma[i] = factorization.singularValue(i);
            coefficients[i] = ImagingHelper.dot(factorization.leftVector(i), rhs);
            capturedSq += coefficients[i] * coefficients[i];
        }
        double outsideSq = Math.max(0.0, rhsNormSq - capturedSq);

        double[] solution = new double[n];
        double residualSq = outsideSq;
        for (int i = 0; i < kept; i++) {
            double filter = alpha > 0.0 ? sigma[i] * sigma[i] / (sigma[i] * sigma[i] + alpha) : 1.0;
            double weight = filter * coefficients[i] / sigma[i];
            double[] vi = factorization.rightVector(i);
            for (int j = 0; j < n; j++) {
                solution[j] += weight * vi[j];
            }
            double leftover = (1.0 - filter) * coefficients[i];
            residualSq += leftover * leftover;
        }

        double parameter = alpha > 0.0 ? alpha : sigma[kept - 1];
        return new RegularizedSolution(solution, Math.sqrt(residualSq), parameter, sigma[kept - 1], kept,
            SolveStatus.OK);
    }

    /**
     * Number of leading singular components allowed by the truncation rule and the floor.
     * Singular values are decreasing, so the retained set is always a prefix.
     */
    public int retainedRank(SvdFactorization factorization, RegularizationConfig config) {
        int limit = truncationLimit(factorization, config);
        int kept = 0;
        while (kept < limit && factorization.singularValue(kept) > config.getSingularValueFloor()) {
            kept++;
        }
        return kept;
    }

    // prefix allowed by the truncation rule alone, before the floor
    private static int truncationLimit(SvdFactorization factorization, RegularizationConfig config) {
        int p = factorization.rank();
        switch (config.getTruncation()) {
            case FIXED_RANK -> {
                return Math.min(config.getRank(), p);
            }
            case RELATIVE_THRESHOLD -> {
                double threshold = config.getRatio() * factorization.largestSingularValue();
                int count = 0;
                while (count < p && factorization.singularValue(count) >= threshold) {
                    count++;
                }
                return count;
            }
            default -> {
                return p;
            }
        }
    }

    /**
     * Discrepancy alpha over the components allowed by the truncation rule. The floor
     * is applied afterwards to the filtered sum, so alpha, and with it every filter
     * factor, does not depend on the floor.
     */
    private double morozovAlpha(SvdFactorization factorization, double[] rhs, double rhsNormSq,
                                RegularizationConfig config) {
        int limit = truncationLimit(factorization, config);
        double[] sigma = new double[limit];
        double[] coefficients = new double[limit];
        double capturedSq = 0.0;
        for (int i = 0; i < limit; i++) {
            sigma[i] = factorization.singularValue(i);
            coefficients[i] = ImagingHelper.dot(factorization.leftVector(i), rhs);
            capturedSq += coefficients[i] * coefficients[i];
        }
        return discrepancyAlpha(sigma, coefficients, Math.max(0.0, rhsNormSq - capturedSq), rhsNormSq, config);
    }

    /**
     * Morozov discrepancy principle: the alpha for which
     * {@code ||A phi_alpha - b|| = delta ||b||}. The residual grows monotonically with
     * alpha, so the root is bracketed on {@code log(alpha)} and refined with Brent's method.
     */
    double discrepancyAlpha(double[] sigma, double[] coefficients, double outsideSq, double rhsNormSq,
                            RegularizationConfig config) {
        double targetSq = config.getNoiseLevel() * config.getNoiseLevel() * rhsNormSq;
        double scale = sigma[0] * sigma[0];
        double lo = Math.log(MIN_ALPHA_FACTOR * scale);
        double hi = Math.log(MAX_ALPHA_FACTOR * scale);

        UnivariateFunction discrepancy = logAlpha -> {
            double alpha = Math.exp(logAlpha);
            double residualSq = outsideSq;
            for (int i = 0; i < sigma.length; i++) {
                double damped = alpha / (sigma[i] * sigma[i] + alpha) * coefficients[i];
                residualSq += damped * damped;
            }
            return residualSq - targetSq;
        };

        if (discrepancy.value(lo) >= 0.0) {
            // data misfit outside the retained range already exceeds the noise level
            return Math.exp(lo);
        }
        if (discrepancy.value(hi) <= 0.0) {
            return Math.exp(hi);
        }
        BrentSolver solver = new BrentSolver(config.getDiscrepancyTolerance());
        return Math.exp(solver.solve(config.getMaxEvaluations(), discrepancy, lo, hi));
    }
}
