package com.phillippitts.scalogram.service.wavelet;

import com.phillippitts.scalogram.domain.WaveletFamily;

/**
 * Negative normalised second derivative of a Gaussian, the "Mexican hat" or Ricker wavelet:
 * {@code psi(t) = 2 / (sqrt(3) * pi^(1/4)) * (1 - t^2) * exp(-t^2 / 2)}.
 */
public final class DerivativeOfGaussianWavelet implements MotherWavelet {

    private static final double NORMALIZATION = 2.0 / (Math.sqrt(3.0) * Math.pow(Math.PI, 0.25));
    private static final double SUPPORT_HALF_WIDTH = 5.0;
    private static final double CENTER_FREQUENCY = Math.sqrt(2.5) / (2.0 * Math.PI);

    @Override
    public WaveletFamily family() {
        return WaveletFamily.DERIVATIVE_OF_GAUSSIAN;
    }

    @Override
    public boolean isComplex() {
        return false;
    }

    @Override
    public double real(double t) {
        double t2 = t * t;
        return NORMALIZATION * (1.0 - t2) * Math.exp(-0.5 * t2);
    }

    @Override
    public double imag(double t) {
        return 0.0;
    }

    @Override
    public double supportHalfWidth() {
        return SUPPORT_HALF_WIDTH;
    }

    /**
     * Fourier factor {@code sqrt(m + 1/2) / (2 pi)} with derivative order {@code m = 2}.
     */
    @Override
    public double centerFrequency() {
        return CENTER_FREQUENCY;
    }
}
