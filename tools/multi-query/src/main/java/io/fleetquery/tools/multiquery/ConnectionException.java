package io.fleetquery.tools.multiquery;

/**
 * Raised when a connection to an endpoint cannot be opened.
 */
public class ConnectionException extends RuntimeException {

    private final String endpointId;

    public ConnectionException(String endpointId, String message, Throwable cause) {
        super(message, cause);
        this.endpointId = endpointId;
    }

    public String endpointId() {
        return endpointId;
    }
}
