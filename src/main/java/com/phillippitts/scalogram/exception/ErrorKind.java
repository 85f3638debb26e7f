package com.phillippitts.scalogram.exception;

/**
 * Classification of per-file pipeline failures.
 *
 * <p>Every {@link ScalogramException} carries one kind so that a batch summary can group
 * failures without inspecting exception types.
 */
public enum ErrorKind {
    INVALID_WAVELET_FAMILY("InvalidWaveletFamily"),
    INVALID_SCALE("InvalidScale"),
    EMPTY_SIGNAL("EmptySignal"),
    NON_FINITE_INPUT("NonFiniteInput"),
    EMPTY_MATRIX("EmptyMatrix"),
    LOAD_FAILURE("LoadFailure"),
    TRANSFORM_FAILURE("TransformFailure"),
    RENDER_FAILURE("RenderFailure"),
    OUTPUT_FAILURE("OutputFailure"),
    CANCELLED("Cancelled");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used in logs and batch summaries (e.g. {@code LoadFailure}).
     *
     * @return display name
     */
    public String getDisplayName() {
        return displayName;
    }
}
