package com.phillippitts.scalogram.exception;

/**
 * Thrown when a scale (or a bound used to derive a scale bank) is non-positive,
 * non-finite or otherwise unusable.
 */
public class InvalidScaleException extends ScalogramException {

    private final double scale;

    public InvalidScaleException(double scale) {
        super(ErrorKind.INVALID_SCALE, "Scale must be positive and finite, got: " + scale);
        this.scale = scale;
    }

    public InvalidScaleException(String message) {
        super(ErrorKind.INVALID_SCALE, message);
        this.scale = Double.NaN;
    }

    /**
     * @return the offending scale, or NaN when the error concerns a whole bank
     */
    public double getScale() {
        return scale;
    }
}
