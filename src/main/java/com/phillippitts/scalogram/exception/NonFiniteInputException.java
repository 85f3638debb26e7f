package com.phillippitts.scalogram.exception;

/**
 * Thrown when a signal contains NaN or infinite samples.
 */
public class NonFiniteInputException extends ScalogramException {

    private final int sampleIndex;

    public NonFiniteInputException(String identifier, int sampleIndex, double value) {
        super(ErrorKind.NON_FINITE_INPUT,
                "Signal " + identifier + " has non-finite sample " + value + " at index " + sampleIndex);
        this.sampleIndex = sampleIndex;
    }

    public int getSampleIndex() {
        return sampleIndex;
    }
}
