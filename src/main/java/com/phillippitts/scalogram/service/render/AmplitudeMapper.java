package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.domain.AmplitudeScale;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Percentile clipping and mapping of magnitudes onto {@code [0, 1]}.
 */
public final class AmplitudeMapper {

    private AmplitudeMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the clip ceiling as a percentile of all values, interpolating linearly between
     * order statistics (estimation type R-7).
     *
     * @param values     magnitude rows
     * @param percentile percentile in {@code (0, 100]}
     * @return ceiling magnitude
     */
    public static double clipCeiling(double[][] values, double percentile) {
        int total = 0;
        for (double[] row : values) {
            total += row.length;
        }
        double[] flat = new double[total];
        int offset = 0;
        for (double[] row : values) {
            System.arraycopy(row, 0, flat, offset, row.length);
            offset += row.length;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(flat, percentile);
    }

    /**
     * Clips one magnitude to the ceiling and maps it to {@code [0, 1]}.
     *
     * <p>{@link AmplitudeScale#LOGARITHMIC} maps {@code ceiling * 10^(-dynamicRangeDb / 20)}
     * and anything below it to 0, and the ceiling to 1, linearly in decibels. A zero ceiling
     * maps everything to 0.
     *
     * @param value          magnitude, non-negative
     * @param ceiling        clip ceiling
     * @param scale          amplitude mapping
     * @param dynamicRangeDb decibel range covered by the logarithmic mapping
     * @return normalised value
     */
    public static double map(double value, double ceiling, AmplitudeScale scale, double dynamicRangeDb) {
        if (ceiling <= 0.0) {
            return 0.0;
        }
        double clipped = Math.min(value, ceiling);
        if (scale == AmplitudeScale.LINEAR) {
            return clipped / ceiling;
        }
        double floor = ceiling * Math.pow(10.0, -dynamicRangeDb / 20.0);
        double db = 20.0 * Math.log10(Math.max(clipped, floor) / ceiling);
        return Math.max(0.0, Math.min(1.0, (db + dynamicRangeDb) / dynamicRangeDb));
    }
}
