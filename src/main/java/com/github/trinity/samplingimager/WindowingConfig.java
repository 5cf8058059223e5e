package com.github.trinity.samplingimager;

import java.util.Objects;

/**
 * Controls how the recorded data is turned into the data operator.
 *
 * <ul>
 *   <li><b>timeWindowStart / timeWindowEnd</b>: optional causal truncation of the traces,
 *       in the units of the {@link TimeAxis}. Unset means the whole axis.</li>
 *   <li><b>noiseFloor</b>: samples with magnitude below this value are zeroed. 0 disables it.</li>
 *   <li><b>domain</b>: whether the operator rows are time samples or frequency bins.</li>
 *   <li><b>timeShifts</b>: number of causal time-shift columns per source. 1 gives the
 *       source-index formulation, larger values the time-domain convolution formulation.</li>
 *   <li><b>minFrequency / maxFrequency</b>: kept band as fractions of Nyquist (frequency domain only).</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and validated by the {@link Builder}.
 * </p>
 *
 * @author Sean Phillips
 */
public final class WindowingConfig {

    public enum Domain {
        TIME,
        FREQUENCY
    }

    private final Double timeWindowStart;
    private final Double timeWindowEnd;
    private final double noiseFloor;
    private final Domain domain;
    private final int timeShifts;
    private final double minFrequency;
    private final double maxFrequency;

    private WindowingConfig(Builder builder) {
        this.timeWindowStart = builder.timeWindowStart;
        this.timeWindowEnd = builder.timeWindowEnd;
        this.noiseFloor = builder.noiseFloor;
        this.domain = builder.domain;
        this.timeShifts = builder.timeShifts;
        this.minFrequency = builder.minFrequency;
        this.maxFrequency = builder.maxFrequency;
    }

    public static WindowingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasTimeWindowStart() {
        return timeWindowStart != null;
    }

    public boolean hasTimeWindowEnd() {
        return timeWindowEnd != null;
    }

    public double getTimeWindowStart() {
        return timeWindowStart == null ? Double.NEGATIVE_INFINITY : timeWindowStart;
    }

    public double getTimeWindowEnd() {
        return timeWindowEnd == null ? Double.POSITIVE_INFINITY : timeWindowEnd;
    }

    public double getNoiseFloor() {
        return noiseFloor;
    }

    public Domain getDomain() {
        return domain;
    }

    public int getTimeShifts() {
        return timeShifts;
    }

    public double getMinFrequency() {
        return minFrequency;
    }

    public double getMaxFrequency() {
        return maxFrequency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WindowingConfig)) {
            return false;
        }
        WindowingConfig that = (WindowingConfig) o;
        return Double.compare(noiseFloor, that.noiseFloor) == 0
            && timeShifts == that.timeShifts
            && Double.compare(minFrequency, that.minFrequency) == 0
            && Double.compare(maxFrequency, that.maxFrequency) == 0
            && Objects.equals(timeWindowStart, that.timeWindowStart)
            && Objects.equals(timeWindowEnd, that.timeWindowEnd)
            && domain == that.domain;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeWindowStart, timeWindowEnd, noiseFloor, domain, timeShifts,
            minFrequency, maxFrequency);
    }

    @Override
    public String toString() {
        return String.format("WindowingConfig[window=(%s, %s), noiseFloor=%g, domain=%s, shifts=%d, band=[%.3f, %.3f]]",
            timeWindowStart, timeWindowEnd, noiseFloor, domain, timeShifts, minFrequency, maxFrequency);
    }

    public static final class Builder {
        private Double timeWindowStart;
        private Double timeWindowEnd;
        private double noiseFloor = 0.0;
        private Domain domain = Domain.TIME;
        private int timeShifts = 1;
        private double minFrequency = 0.0;
        private double maxFrequency = 1.0;

        private Builder() {
        }

        public Builder timeWindow(double start, double end) {
            this.timeWindowStart = start;
            this.timeWindowEnd = end;
            return this;
        }

        public Builder timeWindowStart(double start) {
            this.timeWindowStart = start;
            return this;
        }

        public Builder timeWindowEnd(double end) {
            this.timeWindowEnd = end;
            return this;
        }

        public Builder noiseFloor(double noiseFloor) {
            this.noiseFloor = noiseFloor;
            return this;
        }

        public Builder domain(Domain domain) {
            this.domain = domain;
            return this;
        }

        public Builder timeShifts(int timeShifts) {
            this.timeShifts = timeShifts;
            return this;
        }

        public Builder frequencyBand(double minFrequency, double maxFrequency) {
            this.minFrequency = minFrequency;
            this.maxFrequency = maxFrequency;
            return this;
        }

        public WindowingConfig build() {
            if (timeWindowStart != null && !Double.isFinite(timeWindowStart)
                || timeWindowEnd != null && !Double.isFinite(timeWindowEnd)) {
                throw new IllegalArgumentException("Time window bounds must be finite");
            }
            if (timeWindowStart != null && timeWindowEnd != null && timeWindowEnd < timeWindowStart) {
                throw new IllegalArgumentException("Time window end " + timeWindowEnd
                    + " is before start " + timeWindowStart);
            }
            if (!(noiseFloor >= 0.0) || Double.isInfinite(noiseFloor)) {
                throw new IllegalArgumentException("Noise floor must be finite and >= 0, got " + noiseFloor);
            }
            if (domain == null) {
                throw new IllegalArgumentException("Domain must be set");
            }
            if (timeShifts < 1) {
                throw new IllegalArgumentException("Time shifts must be >= 1, got " + timeShifts);
            }
            if (!(minFrequency >= 0.0 && maxFrequency <= 1.0 && minFrequency < maxFrequency)) {
                throw new IllegalArgumentException("Frequency band must satisfy 0 <= min < max <= 1, got ["
                    + minFrequency + ", " + maxFrequency + "]");
            }
            return new WindowingConfig(this);
        }
    }
}
