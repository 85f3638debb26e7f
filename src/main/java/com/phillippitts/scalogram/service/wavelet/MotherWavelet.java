package com.phillippitts.scalogram.service.wavelet;

import com.phillippitts.scalogram.domain.WaveletFamily;

/**
 * Continuous mother wavelet evaluated at dimensionless time {@code t}.
 *
 * <p>Implementations are stateless and thread-safe.
 */
public interface MotherWavelet {

    WaveletFamily family();

    /**
     * @return {@code true} when {@link #imag(double)} can be non-zero
     */
    boolean isComplex();

    double real(double t);

    /**
     * @return imaginary part; zero for real wavelets
     */
    double imag(double t);

    /**
     * Half-width of the effective support in units of {@code t}; beyond it the envelope is
     * negligible and the kernel is truncated.
     *
     * @return support half-width
     */
    double supportHalfWidth();

    /**
     * Frequency, in cycles per unit {@code t}, at which the wavelet responds most strongly.
     * Dividing by a scale in samples and multiplying by the sample rate gives Hz.
     *
     * @return centre frequency
     */
    double centerFrequency();
}
