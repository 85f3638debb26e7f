package com.phillippitts.scalogram.exception;

/**
 * Thrown when the wavelet transform fails for a reason other than invalid input,
 * such as a scale worker that died or was interrupted.
 */
public class TransformFailureException extends ScalogramException {

    public TransformFailureException(String message, Throwable cause) {
        super(ErrorKind.TRANSFORM_FAILURE, message, cause);
    }
}
