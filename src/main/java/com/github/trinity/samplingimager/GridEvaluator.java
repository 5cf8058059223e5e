package com.github.trinity.samplingimager;

/**
 * Evaluates the indicator functional at one search-grid point.
 *
 * <p>
 * Implementations must be pure functions of read-only inputs: the
 * {@link ParallelScheduler} calls them concurrently from several workers.
 * </p>
 *
 * @author Sean Phillips
 */
@FunctionalInterface
public interface GridEvaluator {

    PointEvaluation evaluate(int pointIndex);
}
