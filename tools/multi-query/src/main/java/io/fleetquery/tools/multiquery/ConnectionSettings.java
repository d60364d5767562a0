package io.fleetquery.tools.multiquery;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable connection and execution settings shared by every endpoint in a run.
 * Thread-safe: all fields are final and immutable.
 */
public record ConnectionSettings(
    String jdbcUrlTemplate,
    Map<String, String> driverProperties,
    int connectTimeoutSeconds,
    int commandTimeoutSeconds,
    int minPoolSize,
    int maxPoolSize,
    int probeConcurrency,
    String probeQuery,
    String readOnlyDirective,
    int fetchSize
) {

    public static final String DEFAULT_JDBC_URL_TEMPLATE = "jdbc:postgresql://%s:%d/%s";
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_COMMAND_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_MIN_POOL_SIZE = 1;
    public static final int DEFAULT_MAX_POOL_SIZE = 5;
    public static final int DEFAULT_PROBE_CONCURRENCY = 5;
    public static final String DEFAULT_PROBE_QUERY = "SELECT 1 AS test_value, version() AS server_version";
    public static final String DEFAULT_READ_ONLY_DIRECTIVE = "SET TRANSACTION READ ONLY";
    public static final int DEFAULT_FETCH_SIZE = 1000;
    public static final String SESSION_OPTIONS_PROPERTY = "options";
    public static final String READ_ONLY_SESSION_OPTIONS = "-c default_transaction_read_only=on";
    public static final int MAX_CONNECT_TIMEOUT_SECONDS = 600;
    public static final int MAX_COMMAND_TIMEOUT_SECONDS = 3600;
    public static final int MAX_PROBE_CONCURRENCY = 64;
    public static final int MIN_FETCH_SIZE = 1;
    public static final int MAX_FETCH_SIZE = 100000;

    public ConnectionSettings {
        Objects.requireNonNull(jdbcUrlTemplate, "JDBC URL template cannot be null");
        Objects.requireNonNull(driverProperties, "Driver properties cannot be null");
        Objects.requireNonNull(probeQuery, "Probe query cannot be null");
        Objects.requireNonNull(readOnlyDirective, "Read-only directive cannot be null");

        if (jdbcUrlTemplate.isBlank()) {
            throw new IllegalArgumentException("JDBC URL template cannot be blank");
        }
        if (probeQuery.isBlank()) {
            throw new IllegalArgumentException("Probe query cannot be blank");
        }
        requireRange("Connect timeout", connectTimeoutSeconds, 1, MAX_CONNECT_TIMEOUT_SECONDS);
        requireRange("Command timeout", commandTimeoutSeconds, 1, MAX_COMMAND_TIMEOUT_SECONDS);
        requireRange("Probe concurrency", probeConcurrency, 1, MAX_PROBE_CONCURRENCY);
        requireRange("Fetch size", fetchSize, MIN_FETCH_SIZE, MAX_FETCH_SIZE);
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("Maximum pool size must be positive, got: " + maxPoolSize);
        }
        if (minPoolSize < 0 || minPoolSize > maxPoolSize) {
            throw new IllegalArgumentException(
                "Minimum pool size must be between 0 and " + maxPoolSize + ", got: " + minPoolSize);
        }
        driverProperties = Map.copyOf(driverProperties);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                name + " must be between " + min + " and " + max + ", got: " + value);
        }
    }

    /**
     * JDBC URL for the endpoint: the template formatted with host, port and database.
     */
    public String jdbcUrl(EndpointDescriptor endpoint) {
        return String.format(Locale.ROOT, jdbcUrlTemplate, endpoint.host(), endpoint.port(), endpoint.database());
    }

    public boolean hasReadOnlyDirective() {
        return !readOnlyDirective.isBlank();
    }

    public static ConnectionSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String jdbcUrlTemplate = DEFAULT_JDBC_URL_TEMPLATE;
        private Map<String, String> driverProperties = defaultDriverProperties(DEFAULT_CONNECT_TIMEOUT_SECONDS);
        private boolean customDriverProperties = false;
        private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
        private int commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_SECONDS;
        private int minPoolSize = DEFAULT_MIN_POOL_SIZE;
        private int maxPoolSize = DEFAULT_MAX_POOL_SIZE;
        private int probeConcurrency = DEFAULT_PROBE_CONCURRENCY;
        private String probeQuery = DEFAULT_PROBE_QUERY;
        private String readOnlyDirective = DEFAULT_READ_ONLY_DIRECTIVE;
        private int fetchSize = DEFAULT_FETCH_SIZE;

        public Builder jdbcUrlTemplate(String jdbcUrlTemplate) {
            this.jdbcUrlTemplate = jdbcUrlTemplate;
            return this;
        }

        public Builder driverProperties(Map<String, String> driverProperties) {
            this.driverProperties = driverProperties;
            this.customDriverProperties = true;
            return this;
        }

        public Builder connectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
            return this;
        }

        public Builder commandTimeoutSeconds(int commandTimeoutSeconds) {
            this.commandTimeoutSeconds = commandTimeoutSeconds;
            return this;
        }

        public Builder minPoolSize(int minPoolSize) {
            this.minPoolSize = minPoolSize;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder probeConcurrency(int probeConcurrency) {
            this.probeConcurrency = probeConcurrency;
            return this;
        }

        public Builder probeQuery(String probeQuery) {
            this.probeQuery = probeQuery;
            return this;
        }

        public Builder readOnlyDirective(String readOnlyDirective) {
            this.readOnlyDirective = readOnlyDirective;
            return this;
        }

        public Builder fetchSize(int fetchSize) {
            this.fetchSize = fetchSize;
            return this;
        }

        public ConnectionSettings build() {
            Map<String, String> properties = customDriverProperties
                ? driverProperties
                : defaultDriverProperties(connectTimeoutSeconds);
            return new ConnectionSettings(
                jdbcUrlTemplate,
                properties,
                connectTimeoutSeconds,
                commandTimeoutSeconds,
                minPoolSize,
                maxPoolSize,
                probeConcurrency,
                probeQuery,
                readOnlyDirective,
                fetchSize
            );
        }

        // PostgreSQL driver: TLS when the server offers it, socket connect timeout in seconds, and
        // every transaction of the session read-only, including one begun after a COMMIT in the script
        private static Map<String, String> defaultDriverProperties(int connectTimeoutSeconds) {
            Map<String, String> properties = new LinkedHashMap<>();
            properties.put("sslmode", "prefer");
            properties.put("connectTimeout", Integer.toString(connectTimeoutSeconds));
            properties.put(SESSION_OPTIONS_PROPERTY, READ_ONLY_SESSION_OPTIONS);
            return properties;
        }
    }
}
