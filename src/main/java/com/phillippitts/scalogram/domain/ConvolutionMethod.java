package com.phillippitts.scalogram.domain;

/**
 * Algorithm used to correlate one kernel with the padded signal.
 */
public enum ConvolutionMethod {

    /** Pick per scale from kernel length and signal length. */
    AUTO,

    /** Sliding dot product, O(n * m). */
    DIRECT,

    /** Zero-padded FFT multiplication, O(N log N). */
    FFT
}
