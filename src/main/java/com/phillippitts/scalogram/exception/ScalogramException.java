package com.phillippitts.scalogram.exception;

import java.util.Objects;

/**
 * Base exception for all scalogram pipeline errors.
 * All domain exceptions extend this class so the batch orchestrator can turn any of them
 * into a tagged failure result.
 */
public class ScalogramException extends RuntimeException {

    private final ErrorKind errorKind;

    public ScalogramException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ScalogramException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
