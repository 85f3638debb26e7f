package com.phillippitts.scalogram.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, uniformly sampled real-valued signal.
 *
 * <p>The sample array is copied on construction and on access, so a signal can be handed to
 * worker threads without coordination.
 */
public final class Signal {

    private final String identifier;
    private final double[] samples;
    private final double sampleRate;

    /**
     * @param identifier name of the source (usually a file name)
     * @param samples    sample values; may be empty, emptiness is rejected by the transform
     * @param sampleRate samples per second, finite and positive
     * @throws IllegalArgumentException if the sample rate is not finite and positive
     */
    public Signal(String identifier, double[] samples, double sampleRate) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.samples = Objects.requireNonNull(samples, "samples must not be null").clone();
        if (!Double.isFinite(sampleRate) || sampleRate <= 0.0) {
            throw new IllegalArgumentException("Sample rate must be positive and finite, got: " + sampleRate);
        }
        this.sampleRate = sampleRate;
    }

    public String identifier() {
        return identifier;
    }

    /**
     * @return a copy of the samples
     */
    public double[] samples() {
        return samples.clone();
    }

    public double sampleAt(int index) {
        return samples[index];
    }

    public int length() {
        return samples.length;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public double sampleRate() {
        return sampleRate;
    }

    /**
     * @return seconds between two consecutive samples
     */
    public double samplingPeriod() {
        return 1.0 / sampleRate;
    }

    /**
     * @return duration covered by the samples, in seconds
     */
    public double durationSeconds() {
        return samples.length / sampleRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signal other)) {
            return false;
        }
        return Double.compare(sampleRate, other.sampleRate) == 0
                && identifier.equals(other.identifier)
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(identifier, sampleRate);
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "Signal{identifier=" + identifier + ", samples=" + samples.length
                + ", sampleRate=" + sampleRate + "}";
    }
}
