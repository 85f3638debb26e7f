package com.phillippitts.scalogram.domain;

/**
 * Boundary extension used before correlating a signal with a kernel.
 */
public enum PaddingMode {

    /** Mirror the signal about its end samples without repeating them. */
    REFLECTIVE,

    /** Treat samples outside the signal as zero. */
    ZERO
}
