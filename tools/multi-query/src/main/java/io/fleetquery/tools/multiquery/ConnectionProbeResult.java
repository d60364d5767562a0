package io.fleetquery.tools.multiquery;

import java.time.Duration;

/**
 * Outcome of a connectivity probe against one endpoint.
 *
 * @param errorCode SQLSTATE reported by the driver, or {@code null}
 * @param serverVersion version string returned by the probe query, or {@code null}
 */
public record ConnectionProbeResult(
    String endpointId,
    boolean success,
    String message,
    String errorCode,
    String serverVersion,
    Duration duration
) {

    static ConnectionProbeResult reachable(String endpointId, String serverVersion, Duration duration) {
        return new ConnectionProbeResult(endpointId, true, "Connection successful", null, serverVersion, duration);
    }

    static ConnectionProbeResult unreachable(String endpointId, String message, String errorCode, Duration duration) {
        return new ConnectionProbeResult(endpointId, false, message, errorCode, null, duration);
    }
}
