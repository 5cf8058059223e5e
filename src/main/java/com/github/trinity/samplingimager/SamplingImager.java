package com.github.trinity.samplingimager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Runs the whole imaging pipeline: validate the inputs, build and factorize the
 * data operator once, evaluate every grid point in parallel, and assemble the field.
 *
 * <pre>
 *     SamplingImager imager = new SamplingImager(inputs);
 *     ImagingResult result = imager.image(WindowingConfig.defaults(),
 *         RegularizationConfig.builder().fixedRank(5).build(), 4);
 *     List&lt;Integer&gt; support = result.getField().levelSet(0.7);
 * </pre>
 *
 * <p>
 * The factorization is kept in a {@link FactorizationCache} owned by this
 * instance, so rerunning with another {@link RegularizationConfig} does not
 * factorize again.
 * </p>
 *
 * @author Sean Phillips
 */
public class SamplingImager {
    private static final Logger LOG = LoggerFactory.getLogger(SamplingImager.class);

    private final ImagingInputs inputs;
    private final SignalOperator signalOperator;
    private final RegularizedInverter inverter;
    private final ParallelScheduler scheduler;
    private final FactorizationCache cache;

    public SamplingImager(ImagingInputs inputs) {
        this(inputs, new RegularizedInverter(), new ParallelScheduler(), new FactorizationCache());
    }

    public SamplingImager(ImagingInputs inputs, RegularizedInverter inverter, ParallelScheduler scheduler,
                          FactorizationCache cache) {
        this.inputs = inputs;
        this.signalOperator = new SignalOperator(inputs.getReceivers(), inputs.getTimeAxis());
        this.inverter = inverter;
        this.scheduler = scheduler;
        this.cache = cache;
    }

    public FactorizationCache getCache() {
        return cache;
    }

    public ImagingResult image(WindowingConfig windowing, RegularizationConfig regularization) {
        return image(windowing, regularization, ParallelScheduler.defaultWorkerCount());
    }

    public ImagingResult image(WindowingConfig windowing, RegularizationConfig regularization, int workerCount) {
        return image(windowing, regularization, workerCount, null);
    }

    /**
     * @param evaluatorOverride evaluator to use instead of the linear-sampling one, or {@code null}.
     *                          It receives the factorization built for this run.
     */
    public ImagingResult image(WindowingConfig windowing, RegularizationConfig regularization, int workerCount,
                               Function<SvdFactorization, GridEvaluator> evaluatorOverride) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1, got " + workerCount);
        }
        inputs.validate();

        long startTime = System.nanoTime();
        SvdFactorization factorization = cache.obtain(signalOperator, inputs.getData(), windowing, inverter);
        LOG.info("Operator ready in {} ms", (System.nanoTime() - startTime) / 1_000_000);

        GridEvaluator evaluator = evaluatorOverride != null
            ? evaluatorOverride.apply(factorization)
            : new SamplingGridEvaluator(inputs.getImpulseResponses(), factorization, regularization, inverter);

        startTime = System.nanoTime();
        AssembledField assembled = scheduler.run(inputs.getGrid(), workerCount, evaluator);
        Diagnostics diagnostics = assembled.getDiagnostics();
        LOG.info("Evaluated {} grid points in {} ms with {}: retained rank {}..{}, {} ill-conditioned",
            assembled.getField().size(), (System.nanoTime() - startTime) / 1_000_000, regularization,
            diagnostics.minRetainedRank(), diagnostics.maxRetainedRank(), diagnostics.illConditionedCount());

        return new ImagingResult(assembled.getField(), diagnostics, factorization.getSingularValues(),
            windowing.getDomain(), regularization);
    }
}
