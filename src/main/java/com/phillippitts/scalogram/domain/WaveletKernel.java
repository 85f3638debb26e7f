package com.phillippitts.scalogram.domain;

import java.util.Objects;

/**
 * Mother wavelet dilated to one scale and sampled at integer offsets.
 *
 * <p>Sample {@code k} holds {@code psi((k - half) / scale) / sqrt(scale)}, so the kernel is
 * centred on index {@link #half()} and its discrete L2 norm matches the mother wavelet's.
 * Real wavelets have no imaginary part.
 */
public final class WaveletKernel {

    private final WaveletFamily family;
    private final double scale;
    private final double[] real;
    private final double[] imag;

    /**
     * @param family wavelet family the kernel was built from
     * @param scale  dilation in samples
     * @param real   real part, odd length
     * @param imag   imaginary part of the same length, or {@code null} for real wavelets
     */
    public WaveletKernel(WaveletFamily family, double scale, double[] real, double[] imag) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(real, "real must not be null");
        if (real.length % 2 == 0) {
            throw new IllegalArgumentException("Kernel length must be odd, got: " + real.length);
        }
        if (imag != null && imag.length != real.length) {
            throw new IllegalArgumentException("Real and imaginary parts differ in length: "
                    + real.length + " vs " + imag.length);
        }
        this.scale = scale;
        this.real = real.clone();
        this.imag = imag == null ? null : imag.clone();
    }

    public WaveletFamily family() {
        return family;
    }

    public double scale() {
        return scale;
    }

    public int length() {
        return real.length;
    }

    /**
     * @return number of samples on each side of the centre sample
     */
    public int half() {
        return real.length / 2;
    }

    public boolean isComplex() {
        return imag != null;
    }

    public double realAt(int index) {
        return real[index];
    }

    public double imagAt(int index) {
        return imag == null ? 0.0 : imag[index];
    }

    /**
     * @return a copy of the real part
     */
    public double[] realPart() {
        return real.clone();
    }

    /**
     * @return a copy of the imaginary part (zeros for real wavelets)
     */
    public double[] imagPart() {
        return imag == null ? new double[real.length] : imag.clone();
    }

    /**
     * @return sum of squared magnitudes of the samples
     */
    public double energy() {
        double sum = 0.0;
        for (int i = 0; i < real.length; i++) {
            double im = imag == null ? 0.0 : imag[i];
            sum += real[i] * real[i] + im * im;
        }
        return sum;
    }
}
