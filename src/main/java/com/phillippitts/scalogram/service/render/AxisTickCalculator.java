package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.domain.AxisTick;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.VerticalAxis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tick positions and labels for the time and vertical axes.
 */
public final class AxisTickCalculator {

    /** Approximate number of intervals along the time axis. */
    static final int TARGET_TIME_INTERVALS = 6;

    /** Maximum number of vertical ticks. */
    static final int MAX_VERTICAL_TICKS = 6;

    private AxisTickCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Time ticks at 1, 2 or 5 times a power of ten seconds, starting at zero.
     *
     * @param sampleCount number of samples in the signal
     * @param sampleRate  samples per second
     * @param width       image width in pixels
     * @return ticks in increasing time order
     */
    public static List<AxisTick> timeTicks(int sampleCount, double sampleRate, int width) {
        List<AxisTick> ticks = new ArrayList<>();
        double lastTime = (sampleCount - 1) / sampleRate;
        if (lastTime <= 0.0) {
            ticks.add(new AxisTick(0, 0.0, "0"));
            return ticks;
        }
        double step = niceStep(lastTime / TARGET_TIME_INTERVALS);
        int decimals = Math.max(0, (int) -Math.floor(Math.log10(step) + 1e-9));
        for (int k = 0; ; k++) {
            double t = k * step;
            if (t > lastTime * (1.0 + 1e-9)) {
                break;
            }
            double sampleIndex = t * sampleRate;
            int pixel = (int) Math.min(width - 1, Math.floor(sampleIndex * width / sampleCount));
            ticks.add(new AxisTick(pixel, t, String.format(Locale.ROOT, "%." + decimals + "f", t)));
        }
        return ticks;
    }

    /**
     * Up to {@value #MAX_VERTICAL_TICKS} evenly spaced vertical ticks, top row first.
     *
     * @param scales          scale bank, one image row per scale
     * @param axis            quantity on the vertical axis; decides the orientation
     * @param centerFrequency mother wavelet centre frequency
     * @param sampleRate      samples per second
     * @return ticks in increasing pixel order
     */
    public static List<AxisTick> verticalTicks(ScaleSet scales, VerticalAxis axis,
                                               double centerFrequency, double sampleRate) {
        int height = scales.size();
        int count = Math.min(MAX_VERTICAL_TICKS, height);
        List<AxisTick> ticks = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            int row = count == 1 ? 0 : (int) Math.round((double) k * (height - 1) / (count - 1));
            int scaleIndex = scaleIndexForRow(row, height, axis);
            double value = axis == VerticalAxis.SCALE
                    ? scales.scaleAt(scaleIndex)
                    : scales.frequencyAt(scaleIndex, centerFrequency, sampleRate);
            ticks.add(new AxisTick(row, value, formatValue(value)));
        }
        return ticks;
    }

    /**
     * Scale index drawn at an image row: the largest scale is on top for {@link VerticalAxis#SCALE},
     * the highest frequency (smallest scale) for {@link VerticalAxis#FREQUENCY}.
     */
    public static int scaleIndexForRow(int row, int height, VerticalAxis axis) {
        return axis == VerticalAxis.SCALE ? height - 1 - row : row;
    }

    static double niceStep(double raw) {
        double magnitude = Math.pow(10.0, Math.floor(Math.log10(raw)));
        double fraction = raw / magnitude;
        double nice;
        if (fraction <= 1.0) {
            nice = 1.0;
        } else if (fraction <= 2.0) {
            nice = 2.0;
        } else if (fraction <= 5.0) {
            nice = 5.0;
        } else {
            nice = 10.0;
        }
        return nice * magnitude;
    }

    static String formatValue(double value) {
        if (value >= 100.0) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        if (value >= 10.0) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
