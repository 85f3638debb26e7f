package com.phillippitts.scalogram.service.wavelet;

import com.phillippitts.scalogram.domain.WaveletFamily;

/**
 * Analytic Morlet wavelet {@code psi(t) = pi^(-1/4) * exp(i * omega0 * t) * exp(-t^2 / 2)}.
 *
 * <p>The correction term of the exact Morlet wavelet is omitted; for {@code omega0 >= 5} it is
 * below 1e-5 of the peak.
 */
public final class MorletWavelet implements MotherWavelet {

    /** Default central angular frequency. */
    public static final double DEFAULT_OMEGA0 = 6.0;

    /** Smallest accepted central angular frequency. */
    public static final double MIN_OMEGA0 = 5.0;

    private static final double NORMALIZATION = Math.pow(Math.PI, -0.25);
    private static final double SUPPORT_HALF_WIDTH = 4.0;

    private final double omega0;

    public MorletWavelet() {
        this(DEFAULT_OMEGA0);
    }

    /**
     * @param omega0 central angular frequency, at least {@link #MIN_OMEGA0}
     */
    public MorletWavelet(double omega0) {
        if (!Double.isFinite(omega0) || omega0 < MIN_OMEGA0) {
            throw new IllegalArgumentException("Morlet omega0 must be at least " + MIN_OMEGA0 + ", got: " + omega0);
        }
        this.omega0 = omega0;
    }

    public double omega0() {
        return omega0;
    }

    @Override
    public WaveletFamily family() {
        return WaveletFamily.MORLET;
    }

    @Override
    public boolean isComplex() {
        return true;
    }

    @Override
    public double real(double t) {
        return NORMALIZATION * Math.exp(-0.5 * t * t) * Math.cos(omega0 * t);
    }

    @Override
    public double imag(double t) {
        return NORMALIZATION * Math.exp(-0.5 * t * t) * Math.sin(omega0 * t);
    }

    @Override
    public double supportHalfWidth() {
        return SUPPORT_HALF_WIDTH;
    }

    /**
     * Fourier factor of Torrence and Compo (1998): {@code (omega0 + sqrt(2 + omega0^2)) / (4 pi)}.
     */
    @Override
    public double centerFrequency() {
        return (omega0 + Math.sqrt(2.0 + omega0 * omega0)) / (4.0 * Math.PI);
    }
}
