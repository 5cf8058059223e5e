package com.github.trinity.samplingimager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear-sampling evaluation of one grid point.
 *
 * <p>
 * The point's impulse response is flattened with the operator's row layout,
 * scaled to unit norm and solved for with the shared factorization. The solution
 * is reduced to a scalar with the configured
 * {@link RegularizationConfig.IndicatorFunctional}. Larger values mean the point is
 * more likely inside or near the scatterer. Points whose solve is ill-conditioned,
 * whose test function vanishes in the window, or whose solution is zero under
 * {@code 1 / ||phi||} get the sentinel value {@value #SENTINEL}.
 * </p>
 *
 * @author Sean Phillips
 */
public class SamplingGridEvaluator implements GridEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(SamplingGridEvaluator.class);

    public static final double SENTINEL = 0.0;

    private final ImpulseResponseVolume responses;
    private final SvdFactorization factorization;
    private final RegularizationConfig config;
    private final RegularizedInverter inverter;

    public SamplingGridEvaluator(ImpulseResponseVolume responses, SvdFactorization factorization,
                                 RegularizationConfig config, RegularizedInverter inverter) {
        this.responses = responses;
        this.factorization = factorization;
        this.config = config;
        this.inverter = inverter;
    }

    @Override
    public PointEvaluation evaluate(int pointIndex) {
        double[] rhs = factorization.getOperator().testFunction(responses, pointIndex);
        double rhsNorm = ImagingHelper.norm(rhs);
        if (rhsNorm > 0.0) {
            for (int i = 0; i < rhs.length; i++) {
                rhs[i] /= rhsNorm;
            }
        }

        RegularizedSolution solution = inverter.solve(factorization, rhs, config);
        double solutionNorm = solution.solutionNorm();
        double condition = solution.getRetainedRank() == 0
            ? Double.POSITIVE_INFINITY
            : factorization.largestSingularValue() / solution.getSmallestRetained();
        PointDiagnostics diagnostics = new PointDiagnostics(condition, solution.getParameter(),
            solution.getResidualNorm(), solutionNorm, solution.getRetainedRank(), solution.getStatus());

        if (solution.getStatus() != SolveStatus.OK) {
            LOG.debug("Grid point {}: {}, emitting sentinel", pointIndex, solution.getStatus());
            return new PointEvaluation(pointIndex, SENTINEL, diagnostics);
        }
        return new PointEvaluation(pointIndex, reduce(solution, solutionNorm), diagnostics);
    }

    private double reduce(RegularizedSolution solution, double solutionNorm) {
        switch (config.getIndicator()) {
            case INVERSE_TIKHONOV_FUNCTIONAL: {
                double weight = config.getTikhonov() == RegularizationConfig.TikhonovSource.NONE
                    ? solution.getSmallestRetained() * solution.getSmallestRetained()
                    : solution.getParameter();
                double residual = solution.getResidualNorm();
                double functional = residual * residual + weight * solutionNorm * solutionNorm;
                return functional > 0.0 ? 1.0 / functional : SENTINEL;
            }
            case INVERSE_SOLUTION_NORM:
            default:
                return solutionNorm > 0.0 ? 1.0 / solutionNorm : SENTINEL;
        }
    }
}
