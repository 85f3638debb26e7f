package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.domain.WaveletKernel;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * A kernel ready to be correlated with signals of one length.
 *
 * <p>Holds the kernel samples as arrays and, on first use, the FFT of the time-reversed
 * conjugate kernel zero-padded to {@link #fftSize()}. Thread-safe.
 */
public final class PreparedKernel {

    private final WaveletKernel kernel;
    private final double[] real;
    private final double[] imag;
    private final int signalLength;
    private final int fftSize;
    private volatile double[][] spectrum;

    PreparedKernel(WaveletKernel kernel, int signalLength) {
        this.kernel = kernel;
        this.real = kernel.realPart();
        this.imag = kernel.imagPart();
        this.signalLength = signalLength;
        this.fftSize = nextPowerOfTwo(signalLength + 4 * kernel.half());
    }

    public WaveletKernel kernel() {
        return kernel;
    }

    public int signalLength() {
        return signalLength;
    }

    public int half() {
        return kernel.half();
    }

    public int length() {
        return real.length;
    }

    /**
     * @return transform length that holds the full linear correlation without wrap-around
     */
    public int fftSize() {
        return fftSize;
    }

    double[] real() {
        return real;
    }

    double[] imag() {
        return imag;
    }

    /**
     * @return {@code [re, im]} spectrum of {@code r[j] = conj(kernel[length - 1 - j])}
     */
    double[][] spectrum() {
        double[][] result = spectrum;
        if (result == null) {
            synchronized (this) {
                result = spectrum;
                if (result == null) {
                    result = computeSpectrum();
                    spectrum = result;
                }
            }
        }
        return result;
    }

    private double[][] computeSpectrum() {
        double[][] data = new double[2][fftSize];
        int last = real.length - 1;
        for (int j = 0; j <= last; j++) {
            data[0][j] = real[last - j];
            data[1][j] = -imag[last - j];
        }
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
        return data;
    }

    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        int highest = Integer.highestOneBit(value - 1) << 1;
        if (highest <= 0) {
            throw new IllegalArgumentException("Signal too long for FFT correlation: " + value);
        }
        return highest;
    }
}
