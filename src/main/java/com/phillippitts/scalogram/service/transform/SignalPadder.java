package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.domain.PaddingMode;

/**
 * Extends a signal by {@code width} samples on each side.
 */
public final class SignalPadder {

    private SignalPadder() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns {@code samples} padded to length {@code samples.length + 2 * width}.
     *
     * <p>{@link PaddingMode#REFLECTIVE} mirrors about the end samples without repeating them
     * ({@code d c b | a b c d | c b a}) and keeps folding when the pad is longer than the
     * signal. A single-sample signal is repeated.
     *
     * @param samples signal, at least one sample
     * @param width   samples to add on each side, non-negative
     * @param mode    padding policy
     * @return new padded array
     */
    public static double[] pad(double[] samples, int width, PaddingMode mode) {
        if (width < 0) {
            throw new IllegalArgumentException("Padding width must not be negative, got: " + width);
        }
        int n = samples.length;
        double[] padded = new double[n + 2 * width];
        System.arraycopy(samples, 0, padded, width, n);
        if (mode == PaddingMode.ZERO || width == 0) {
            return padded;
        }
        for (int i = 0; i < width; i++) {
            padded[width - 1 - i] = samples[reflectIndex(-1 - i, n)];
            padded[width + n + i] = samples[reflectIndex(n + i, n)];
        }
        return padded;
    }

    /**
     * Maps any integer position onto {@code [0, n)} by repeated mirroring about the end samples.
     *
     * @param index position, possibly outside the signal
     * @param n     signal length, at least one
     * @return index inside the signal
     */
    static int reflectIndex(int index, int n) {
        if (n == 1) {
            return 0;
        }
        int period = 2 * (n - 1);
        int m = Math.floorMod(index, period);
        return m < n ? m : period - m;
    }
}
