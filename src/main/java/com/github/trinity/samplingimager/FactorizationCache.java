package com.github.trinity.samplingimager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-owned handle on the operator and its factorization.
 *
 * <p>
 * Repeated runs over the same recorded data and windowing (for instance with
 * different regularization settings) reuse the factorization. Passing a different
 * signal operator or data volume instance, or an unequal windowing configuration,
 * rebuilds it, and
 * {@link #invalidate()} drops it explicitly. Not thread-safe: populate it before
 * the parallel phase.
 * </p>
 *
 * @author Sean Phillips
 */
public class FactorizationCache {
    private static final Logger LOG = LoggerFactory.getLogger(FactorizationCache.class);

    private SignalOperator signalOperator;
    private DataVolume data;
    private WindowingConfig windowing;
    private SvdFactorization factorization;

    /**
     * Returns the cached factorization for {@code (data, windowing)}, building and
     * factorizing the operator first if needed.
     */
    public SvdFactorization obtain(SignalOperator signalOperator, DataVolume data, WindowingConfig windowing,
                                   RegularizedInverter inverter) {
        if (factorization != null && this.signalOperator == signalOperator && this.data == data
            && this.windowing.equals(windowing)) {
            LOG.debug("Reusing cached factorization for {}", windowing);
            return factorization;
        }
        invalidate();
        Operator operator = signalOperator.build(data, windowing);
        SvdFactorization built = inverter.factorize(operator);
        this.signalOperator = signalOperator;
        this.data = data;
        this.windowing = windowing;
        this.factorization = built;
        return built;
    }

    public boolean isValid() {
        return factorization != null;
    }

    /**
     * @return the cached factorization, or {@code null} if none is held
     */
    public SvdFactorization current() {
        return factorization;
    }

    public void invalidate() {
        signalOperator = null;
        data = null;
        windowing = null;
        factorization = null;
    }
}
