package com.phillippitts.scalogram.exception;

import java.nio.file.Path;

/**
 * Thrown by an output collaborator when a rendered scalogram cannot be persisted.
 */
public class OutputFailureException extends ScalogramException {

    private final Path target;

    public OutputFailureException(Path target, Throwable cause) {
        super(ErrorKind.OUTPUT_FAILURE, "Failed to write scalogram to " + target, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
