package com.github.trinity.samplingimager;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * The discretized data operator together with its row layout.
 *
 * <p>
 * Rows are receiver-major. Inside a receiver block they are the windowed time
 * samples (time domain) or the real and imaginary parts of the kept frequency bins
 * (frequency domain). Columns are {@code source * timeShifts + shift}.
 * </p>
 *
 * <p>
 * Built only by {@link SignalOperator}; read-only afterwards.
 * </p>
 *
 * @author Sean Phillips
 */
public final class Operator {

    private static final double SQRT2 = Math.sqrt(2.0);

    private final RealMatrix matrix;
    private final WindowingConfig.Domain domain;
    private final int receivers;
    private final int sources;
    private final int timeShifts;
    private final int windowStart;
    private final int windowLength;
    private final int fftSize;
    private final int[] keptBins;
    private final double timeStep;

    Operator(RealMatrix matrix, WindowingConfig.Domain domain, int receivers, int sources, int timeShifts,
             int windowStart, int windowLength, int fftSize, int[] keptBins, double timeStep) {
        this.matrix = matrix;
        this.domain = domain;
        this.receivers = receivers;
        this.sources = sources;
        this.timeShifts = timeShifts;
        this.windowStart = windowStart;
        this.windowLength = windowLength;
        this.fftSize = fftSize;
        this.keptBins = keptBins;
        this.timeStep = timeStep;
    }

    /**
     * @return a copy of the operator matrix
     */
    public RealMatrix getMatrix() {
        return matrix.copy();
    }

    RealMatrix matrixView() {
        return matrix;
    }

    public int getRowCount() {
        return matrix.getRowDimension();
    }

    public int getColumnCount() {
        return matrix.getColumnDimension();
    }

    public WindowingConfig.Domain getDomain() {
        return domain;
    }

    public int getReceivers() {
        return receivers;
    }

    public int getSources() {
        return sources;
    }

    public int getTimeShifts() {
        return timeShifts;
    }

    public int getWindowStart() {
        return windowStart;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public double getTimeStep() {
        return timeStep;
    }

    /**
     * Rows contributed by each receiver.
     */
    public int rowsPerReceiver() {
        return domain == WindowingConfig.Domain.TIME ? windowLength : spectralRowCount(keptBins, fftSize);
    }

    /**
     * Flattens the impulse response of one grid point into a right-hand side with
     * the same row ordering as the operator.
     *
     * @param responses  impulse responses; receiver and time extents must match the operator's inputs
     * @param gridPoint  grid index
     * @return the test function, length {@link #getRowCount()}
     */
    public double[] testFunction(ImpulseResponseVolume responses, int gridPoint) {
        if (responses.receivers() != receivers) {
            throw new DimensionMismatchException("impulse response receivers", receivers, responses.receivers());
        }
        if (responses.timeSamples() < windowStart + windowLength) {
            throw new DimensionMismatchException("impulse response time samples",
                windowStart + windowLength, responses.timeSamples());
        }
        int perReceiver = rowsPerReceiver();
        double[] rhs = new double[receivers * perReceiver];
        for (int r = 0; r < receivers; r++) {
            double[] window = new double[windowLength];
            for (int t = 0; t < windowLength; t++) {
                window[t] = responses.get(r, windowStart + t, gridPoint);
            }
            if (domain == WindowingConfig.Domain.TIME) {
                System.arraycopy(window, 0, rhs, r * perReceiver, windowLength);
            } else {
                Complex[] spectrum = spectrum(window, fftSize);
                writeSpectralRows(spectrum, 0, keptBins, fftSize, rhs, r * perReceiver);
            }
        }
        return rhs;
    }

    static Complex[] spectrum(double[] window, int fftSize) {
        double[] padded = new double[fftSize];
        System.arraycopy(window, 0, padded, 0, window.length);
        FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.UNITARY);
        return fft.transform(padded, TransformType.FORWARD);
    }

    static int spectralRowCount(int[] keptBins, int fftSize) {
        int rows = 0;
        for (int bin : keptBins) {
            rows += isSelfConjugate(bin, fftSize) ? 1 : 2;
        }
        return rows;
    }

    /**
     * Writes the kept bins of {@code spectrum}, delayed by {@code shift} samples, as
     * real rows. Interior bins are scaled by sqrt(2) so the full band is an isometry
     * of the padded trace; the imaginary parts of DC and Nyquist are always zero and skipped.
     */
    static void writeSpectralRows(Complex[] spectrum, int shift, int[] keptBins, int fftSize,
                                  double[] target, int offset) {
        int row = offset;
        for (int bin : keptBins) {
            Complex value = spectrum[bin];
            if (shift != 0) {
                double phase = -2.0 * Math.PI * bin * (double) shift / fftSize;
                value = value.multiply(new Complex(Math.cos(phase), Math.sin(phase)));
            }
            if (isSelfConjugate(bin, fftSize)) {
                target[row++] = value.getReal();
            } else {
                target[row++] = SQRT2 * value.getReal();
                target[row++] = SQRT2 * value.getImaginary();
            }
        }
    }

    private static boolean isSelfConjugate(int bin, int fftSize) {
        return bin == 0 || bin == fftSize / 2;
    }
}
