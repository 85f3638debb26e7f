package com.phillippitts.scalogram.domain;

import com.phillippitts.scalogram.exception.InvalidScaleException;

import java.util.Arrays;

/**
 * Strictly increasing bank of positive wavelet scales, expressed in samples.
 *
 * <p>Banks are usually geometric: {@code s_j = min * 2^(j / pointsPerOctave)}, which gives
 * every octave the same number of rows in the scalogram.
 */
public final class ScaleSet {

    private static final double OCTAVE_EPSILON = 1e-9;

    private final double[] scales;

    private ScaleSet(double[] scales) {
        this.scales = scales;
    }

    /**
     * Creates a scale set from explicit values.
     *
     * @param scales positive, finite, strictly increasing values (at least one)
     * @return the scale set
     * @throws InvalidScaleException if the values violate any of the above
     */
    public static ScaleSet of(double... scales) {
        if (scales == null || scales.length == 0) {
            throw new InvalidScaleException("Scale set must contain at least one scale");
        }
        double[] copy = scales.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i]) || copy[i] <= 0.0) {
                throw new InvalidScaleException(copy[i]);
            }
            if (i > 0 && copy[i] <= copy[i - 1]) {
                throw new InvalidScaleException("Scales must be strictly increasing: "
                        + copy[i - 1] + " followed by " + copy[i]);
            }
        }
        return new ScaleSet(copy);
    }

    /**
     * Creates a geometric scale bank between two bounds.
     *
     * <p>The bank always starts at {@code min}; the last scale is the largest
     * {@code min * 2^(j / pointsPerOctave)} that does not exceed {@code max}.
     *
     * @param min             smallest scale, positive
     * @param max             upper bound, at least {@code min}
     * @param pointsPerOctave scales per doubling, at least 1
     * @return the scale set
     * @throws InvalidScaleException if the bounds are unusable
     */
    public static ScaleSet geometric(double min, double max, int pointsPerOctave) {
        if (!Double.isFinite(min) || min <= 0.0) {
            throw new InvalidScaleException(min);
        }
        if (!Double.isFinite(max) || max <= 0.0) {
            throw new InvalidScaleException(max);
        }
        if (max < min) {
            throw new InvalidScaleException("Maximum scale " + max + " is below minimum scale " + min);
        }
        if (pointsPerOctave < 1) {
            throw new InvalidScaleException("Points per octave must be at least 1, got: " + pointsPerOctave);
        }
        double octaves = Math.log(max / min) / Math.log(2.0);
        int last = (int) Math.floor(octaves * pointsPerOctave + OCTAVE_EPSILON);
        double[] values = new double[last + 1];
        for (int j = 0; j <= last; j++) {
            values[j] = min * Math.pow(2.0, (double) j / pointsPerOctave);
        }
        return of(values);
    }

    /**
     * Creates a geometric scale bank covering a frequency band of interest.
     *
     * <p>Uses {@code scale = centerFrequency * sampleRate / frequency}, so the highest
     * frequency yields the smallest scale.
     *
     * @param minFrequency    lowest frequency of interest in Hz
     * @param maxFrequency    highest frequency of interest in Hz
     * @param pointsPerOctave scales per doubling
     * @param centerFrequency centre frequency of the mother wavelet (cycles per unit scale)
     * @param sampleRate      samples per second
     * @return the scale set
     * @throws InvalidScaleException if the band is empty or non-positive
     */
    public static ScaleSet forFrequencyBand(double minFrequency, double maxFrequency, int pointsPerOctave,
                                            double centerFrequency, double sampleRate) {
        if (!Double.isFinite(minFrequency) || minFrequency <= 0.0
                || !Double.isFinite(maxFrequency) || maxFrequency <= 0.0) {
            throw new InvalidScaleException("Frequency bounds must be positive and finite: "
                    + minFrequency + " .. " + maxFrequency);
        }
        if (maxFrequency < minFrequency) {
            throw new InvalidScaleException("Maximum frequency " + maxFrequency
                    + " is below minimum frequency " + minFrequency);
        }
        double smallest = centerFrequency * sampleRate / maxFrequency;
        double largest = centerFrequency * sampleRate / minFrequency;
        return geometric(smallest, largest, pointsPerOctave);
    }

    public int size() {
        return scales.length;
    }

    public double scaleAt(int index) {
        return scales[index];
    }

    public double min() {
        return scales[0];
    }

    public double max() {
        return scales[scales.length - 1];
    }

    /**
     * Equivalent Fourier frequency of one scale.
     *
     * @param index           scale index
     * @param centerFrequency centre frequency of the mother wavelet
     * @param sampleRate      samples per second
     * @return frequency in Hz
     */
    public double frequencyAt(int index, double centerFrequency, double sampleRate) {
        return centerFrequency * sampleRate / scales[index];
    }

    /**
     * @return a copy of the scales
     */
    public double[] toArray() {
        return scales.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ScaleSet other && Arrays.equals(scales, other.scales));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scales);
    }

    @Override
    public String toString() {
        return "ScaleSet{size=" + scales.length + ", min=" + min() + ", max=" + max() + "}";
    }
}
