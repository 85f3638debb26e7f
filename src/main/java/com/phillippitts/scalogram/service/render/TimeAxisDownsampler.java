package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.domain.CoefficientMatrix;

/**
 * Reduces the time axis of a coefficient matrix by max-pooling.
 *
 * <p>Output column {@code i} of {@code w} covers input columns
 * {@code [floor(i * n / w), floor((i + 1) * n / w))} and holds their maximum, so short
 * transients survive the reduction. Matrices that are already narrow enough are copied
 * unchanged; there is no upsampling.
 */
public final class TimeAxisDownsampler {

    private TimeAxisDownsampler() {
        // Utility class - prevent instantiation
    }

    /**
     * @param matrix      coefficient magnitudes
     * @param targetWidth maximum number of output columns; zero or less disables pooling
     * @return new {@code rows x min(n, targetWidth)} array
     */
    public static double[][] maxPool(CoefficientMatrix matrix, int targetWidth) {
        int rows = matrix.rows();
        int n = matrix.columns();
        int width = outputWidth(n, targetWidth);
        double[][] result = new double[rows][];
        for (int r = 0; r < rows; r++) {
            double[] source = matrix.magnitudeRow(r);
            if (width == n) {
                result[r] = source;
                continue;
            }
            double[] pooled = new double[width];
            for (int i = 0; i < width; i++) {
                int from = bucketStart(i, n, width);
                int to = bucketStart(i + 1, n, width);
                double max = source[from];
                for (int c = from + 1; c < to; c++) {
                    max = Math.max(max, source[c]);
                }
                pooled[i] = max;
            }
            result[r] = pooled;
        }
        return result;
    }

    /**
     * @param columns     input width
     * @param targetWidth requested width; zero or less keeps the input width
     * @return width after pooling
     */
    public static int outputWidth(int columns, int targetWidth) {
        return targetWidth <= 0 || columns <= targetWidth ? columns : targetWidth;
    }

    private static int bucketStart(int bucket, int n, int width) {
        return (int) ((long) bucket * n / width);
    }
}
