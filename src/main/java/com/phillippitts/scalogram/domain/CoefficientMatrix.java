package com.phillippitts.scalogram.domain;

import java.util.Objects;

/**
 * Magnitudes of the wavelet coefficients indexed by (scale index, time index), with an
 * optional phase surface.
 *
 * <p>All magnitudes are finite and non-negative; the constructor enforces it.
 */
public final class CoefficientMatrix {

    private final double[][] magnitude;
    private final double[][] phase;
    private final TransformMetadata metadata;
    private final int columns;

    /**
     * @param magnitude rows of equal length, one per scale; taken over without copying
     * @param phase     phase rows in radians with the same shape, or {@code null}
     * @param metadata  transform description with one entry per row
     */
    public CoefficientMatrix(double[][] magnitude, double[][] phase, TransformMetadata metadata) {
        this.magnitude = Objects.requireNonNull(magnitude, "magnitude must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.columns = magnitude.length == 0 ? 0 : magnitude[0].length;
        for (int r = 0; r < magnitude.length; r++) {
            double[] row = magnitude[r];
            if (row.length != columns) {
                throw new IllegalArgumentException("Row " + r + " has " + row.length
                        + " columns, expected " + columns);
            }
            for (int c = 0; c < row.length; c++) {
                if (!Double.isFinite(row[c]) || row[c] < 0.0) {
                    throw new IllegalArgumentException("Magnitude at (" + r + ", " + c
                            + ") is not a finite non-negative value: " + row[c]);
                }
            }
        }
        if (phase != null && (phase.length != magnitude.length
                || (phase.length > 0 && phase[0].length != columns))) {
            throw new IllegalArgumentException("Phase matrix shape differs from magnitude matrix");
        }
        this.phase = phase;
    }

    public int rows() {
        return magnitude.length;
    }

    public int columns() {
        return columns;
    }

    public boolean isEmpty() {
        return magnitude.length == 0 || columns == 0;
    }

    public double magnitude(int scaleIndex, int timeIndex) {
        return magnitude[scaleIndex][timeIndex];
    }

    /**
     * @param scaleIndex row index
     * @return a copy of one magnitude row
     */
    public double[] magnitudeRow(int scaleIndex) {
        return magnitude[scaleIndex].clone();
    }

    public boolean hasPhase() {
        return phase != null;
    }

    /**
     * @throws IllegalStateException if phase output was not requested
     */
    public double phase(int scaleIndex, int timeIndex) {
        if (phase == null) {
            throw new IllegalStateException("Phase was not computed for this matrix");
        }
        return phase[scaleIndex][timeIndex];
    }

    /**
     * @return largest magnitude of one row
     */
    public double rowMaximum(int scaleIndex) {
        double max = 0.0;
        for (double v : magnitude[scaleIndex]) {
            max = Math.max(max, v);
        }
        return max;
    }

    public TransformMetadata metadata() {
        return metadata;
    }
}
