package com.github.trinity.samplingimager;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the discretized data operator whose range characterizes the interior of
 * the scatterer.
 *
 * <p>
 * With {@code K = timeShifts} the operator acts on densities g(s, k) as a causal
 * convolution with the recorded data:
 * </p>
 * <pre>
 * (A g)(r, t) = sum_s sum_k d(r, t - k, s) g(s, k) dt
 * </pre>
 * <p>
 * {@code K = 1} reduces it to the source-index (near-field matrix) formulation.
 * In the frequency domain the shift becomes a phase factor on the zero-padded trace.
 * </p>
 *
 * <p>
 * The build is deterministic: identical inputs and configuration give a
 * bit-identical matrix.
 * </p>
 *
 * @author Sean Phillips
 */
public class SignalOperator {
    private static final Logger LOG = LoggerFactory.getLogger(SignalOperator.class);

    private final ReceiverSet receivers;
    private final TimeAxis timeAxis;

    public SignalOperator(ReceiverSet receivers, TimeAxis timeAxis) {
        this.receivers = receivers;
        this.timeAxis = timeAxis;
    }

    public ReceiverSet getReceivers() {
        return receivers;
    }

    public TimeAxis getTimeAxis() {
        return timeAxis;
    }

    /**
     * Builds the operator for the given data and windowing.
     *
     * @throws DimensionMismatchException   if the data extents disagree with the receivers or time axis
     * @throws DegenerateOperatorException  if the window is empty, a column vanishes or a receiver has no signal
     */
    public Operator build(DataVolume data, WindowingConfig config) {
        checkExtents(data);

        int windowStart = timeAxis.indexAtOrAfter(config.getTimeWindowStart());
        int windowEnd = timeAxis.indexAtOrBefore(config.getTimeWindowEnd());
        if (windowStart >= timeAxis.size() || windowEnd < 0 || windowEnd < windowStart) {
            throw new DegenerateOperatorException("window", windowStart,
                "time window [" + config.getTimeWindowStart() + ", " + config.getTimeWindowEnd()
                    + "] contains no samples");
        }
        int windowLength = windowEnd - windowStart + 1;
        int shifts = config.getTimeShifts();
        if (shifts > windowLength) {
            throw new DegenerateOperatorException("window", windowLength,
                shifts + " time shifts exceed the " + windowLength + "-sample window");
        }

        int nReceivers = receivers.size();
        int nSources = data.sources();
        double dt = timeAxis.meanStep();
        double[][][] traces = windowedTraces(data, windowStart, windowLength, config.getNoiseFloor());

        double[][] matrix;
        int fftSize = 0;
        int[] keptBins = new int[0];
        if (config.getDomain() == WindowingConfig.Domain.TIME) {
            matrix = timeDomainMatrix(traces, shifts, dt);
        } else {
            if (!timeAxis.isUniform()) {
                throw new IllegalArgumentException("Frequency-domain operator requires a uniform time axis");
            }
            // at least two points, so a one-sample window still has a DC and a Nyquist bin
            fftSize = ImagingHelper.nextPowerOfTwo(Math.max(2, windowLength + shifts - 1));
            keptBins = keptBins(fftSize, config.getMinFrequency(), config.getMaxFrequency());
            if (keptBins.length == 0) {
                throw new DegenerateOperatorException("window", fftSize,
                    "frequency band keeps no bins at FFT size " + fftSize);
            }
            matrix = frequencyDomainMatrix(traces, shifts, dt, fftSize, keptBins);
        }

        int rowsPerReceiver = matrix.length / nReceivers;
        checkDegenerate(matrix, nReceivers, rowsPerReceiver);

        LOG.info("Built {} operator: {} x {} ({} receivers, {} sources, {} shifts, window [{}, {}])",
            config.getDomain(), matrix.length, matrix[0].length, nReceivers, nSources, shifts,
            windowStart, windowEnd);
        return new Operator(new Array2DRowRealMatrix(matrix, false), config.getDomain(), nReceivers,
            nSources, shifts, windowStart, windowLength, fftSize, keptBins, dt);
    }

    /**
     * Fails fast when the data volume does not match the receivers or the time axis.
     */
    public void checkExtents(DataVolume data) {
        if (data.receivers() != receivers.size()) {
            throw new DimensionMismatchException("data receivers", receivers.size(), data.receivers());
        }
        if (data.timeSamples() != timeAxis.size()) {
            throw new DimensionMismatchException("data time samples", timeAxis.size(), data.timeSamples());
        }
    }

    /**
     * Same extent check for the impulse responses, plus the grid size.
     */
    public void checkExtents(ImpulseResponseVolume responses, SearchGrid grid) {
        if (responses.receivers() != receivers.size()) {
            throw new DimensionMismatchException("impulse response receivers", receivers.size(),
                responses.receivers());
        }
        if (responses.timeSamples() != timeAxis.size()) {
            throw new DimensionMismatchException("impulse response time samples", timeAxis.size(),
                responses.timeSamples());
        }
        if (responses.gridPoints() != grid.size()) {
            throw new DimensionMismatchException("impulse response grid points", grid.size(),
                responses.gridPoints());
        }
        if (grid.dimension() != receivers.dimension()) {
            throw new DimensionMismatchException("search grid dimension", receivers.dimension(),
                grid.dimension());
        }
    }

    // traces[r][s][t], windowed and thresholded
    private static double[][][] windowedTraces(DataVolume data, int windowStart, int windowLength,
                                               double noiseFloor) {
        double[][][] traces = new double[data.receivers()][data.sources()][windowLength];
        for (int r = 0; r < data.receivers(); r++) {
            for (int s = 0; s < data.sources(); s++) {
                for (int t = 0; t < windowLength; t++) {
                    double value = data.get(r, windowStart + t, s);
                    traces[r][s][t] = Math.abs(value) < noiseFloor ? 0.0 : value;
                }
            }
        }
        return traces;
    }

    private static double[][] timeDomainMatrix(double[][][] traces, int shifts, double dt) {
        int nReceivers = traces.length;
        int nSources = traces[0].length;
        int windowLength = traces[0][0].length;
        double[][] A = new double[nReceivers * windowLength][nSources * shifts];
        for (int r = 0; r < nReceivers; r++) {
            for (int s = 0; s < nSources; s++) {
                double[] trace = traces[r][s];
                for (int k = 0; k < shifts; k++) {
                    int col = s * shifts + k;
                    for (int t = k; t < windowLength; t++) {
                        A[r * windowLength + t][col] = trace[t - k] * dt;
                    }
                }
            }
        }
        return A;
    }

    private static double[][] frequencyDomainMatrix(double[][][] traces, int shifts, double dt,
                                                    int fftSize, int[] keptBins) {
        int nReceivers = traces.length;
        int nSources = traces[0].length;
        int perReceiver = Operator.spectralRowCount(keptBins, fftSize);
        double[][] A = new double[nReceivers * perReceiver][nSources * shifts];
        double[] column = new double[perReceiver];
        for (int r = 0; r < nReceivers; r++) {
            for (int s = 0; s < nSources; s++) {
                Complex[] spectrum = Operator.spectrum(traces[r][s], fftSize);
                for (int k = 0; k < shifts; k++) {
                    Operator.writeSpectralRows(spectrum, k, keptBins, fftSize, column, 0);
                    int col = s * shifts + k;
                    for (int i = 0; i < perReceiver; i++) {
                        A[r * perReceiver + i][col] = column[i] * dt;
                    }
                }
            }
        }
        return A;
    }

    static int[] keptBins(int fftSize, double minFrequency, double maxFrequency) {
        int nyquist = fftSize / 2;
        List<Integer> bins = new ArrayList<>();
        for (int j = 0; j <= nyquist; j++) {
            double fraction = (double) j / nyquist;
            if (fraction >= minFrequency && fraction <= maxFrequency) {
                bins.add(j);
            }
        }
        return bins.stream().mapToInt(Integer::intValue).toArray();
    }

    // Individual zero rows are legal (causal shifts produce them); zero columns and silent receivers are not.
    private static void checkDegenerate(double[][] A, int nReceivers, int rowsPerReceiver) {
        for (int r = 0; r < nReceivers; r++) {
            boolean silent = true;
            for (int i = r * rowsPerReceiver; i < (r + 1) * rowsPerReceiver && silent; i++) {
                for (double v : A[i]) {
                    if (v != 0.0) {
                        silent = false;
                        break;
                    }
                }
            }
            if (silent) {
                throw new DegenerateOperatorException("receiver", r,
                    "receiver has no signal left after windowing and noise thresholding");
            }
        }
        int cols = A[0].length;
        for (int c = 0; c < cols; c++) {
            boolean zero = true;
            for (double[] row : A) {
                if (row[c] != 0.0) {
                    zero = false;
                    break;
                }
            }
            if (zero) {
                throw new DegenerateOperatorException("column", c,
                    "operator column is identically zero under the chosen windowing");
            }
        }
    }
}
