package com.phillippitts.scalogram.exception;

/**
 * Thrown by an input collaborator when a signal cannot be read or parsed.
 */
public class LoadFailureException extends ScalogramException {

    private final String identifier;

    public LoadFailureException(String identifier, String reason) {
        super(ErrorKind.LOAD_FAILURE, "Failed to load " + identifier + ": " + reason);
        this.identifier = identifier;
    }

    public LoadFailureException(String identifier, String reason, Throwable cause) {
        super(ErrorKind.LOAD_FAILURE, "Failed to load " + identifier + ": " + reason, cause);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
