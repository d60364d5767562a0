package io.fleetquery.tools.multiquery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One configured target database. Field names on the wire follow the environments file
 * ({@code clientId}, {@code hostname}, ...).
 */
public record EndpointDescriptor(
    @JsonProperty("clientId") String id,
    @JsonProperty("hostname") String host,
    @JsonProperty("port") int port,
    @JsonProperty("database") String database,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password
) {

    /**
     * Connection URI for display; the password is always masked.
     */
    public String displayUri() {
        return "postgresql://" + username + ":***@" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "ClientId: " + id + ", Host: " + host + ":" + port + ", Database: " + database
            + ", User: " + username + ", Password: ***";
    }
}
