package com.phillippitts.scalogram.exception;

/**
 * Thrown when a transform is requested for a signal without samples.
 */
public class EmptySignalException extends ScalogramException {

    public EmptySignalException(String identifier) {
        super(ErrorKind.EMPTY_SIGNAL, "Signal has no samples: " + identifier);
    }
}
