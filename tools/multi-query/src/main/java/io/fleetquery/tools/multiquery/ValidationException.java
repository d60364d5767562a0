package io.fleetquery.tools.multiquery;

/**
 * Raised when user input (paths, environments file, query text, options) is rejected.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
