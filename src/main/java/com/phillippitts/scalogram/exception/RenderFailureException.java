package com.phillippitts.scalogram.exception;

/**
 * Thrown when a coefficient matrix cannot be turned into an image.
 */
public class RenderFailureException extends ScalogramException {

    public RenderFailureException(String message) {
        super(ErrorKind.RENDER_FAILURE, message);
    }

    public RenderFailureException(String message, Throwable cause) {
        super(ErrorKind.RENDER_FAILURE, message, cause);
    }
}
