package io.fleetquery.tools.multiquery;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens connections to endpoints through one small HikariCP pool per endpoint id and
 * probes endpoint reachability with bounded fan-out.
 */
public class ConnectionFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFactory.class);
    private static final long VALIDATION_TIMEOUT_MS = 5000;
    private static final long LEAK_DETECTION_THRESHOLD_MS = 60000;

    private final ConnectionSettings settings;
    private final ConcurrentHashMap<String, HikariDataSource> pools = new ConcurrentHashMap<>();

    public ConnectionFactory(ConnectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    public ConnectionSettings settings() {
        return settings;
    }

    /**
     * Opens a connection to the endpoint. The caller owns the returned connection and must close it.
     *
     * @throws ConnectionException if the pool cannot be created or no connection can be obtained
     */
    public Connection open(EndpointDescriptor endpoint) {
        try {
            return pool(endpoint).getConnection();
        } catch (SQLException e) {
            throw new ConnectionException(endpoint.id(), e.getMessage(), e);
        } catch (RuntimeException e) {
            // HikariCP reports pool start-up failures as PoolInitializationException
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectionException(endpoint.id(), cause.getMessage(), cause);
        }
    }

    /**
     * Runs the probe query against the endpoint. Never throws; failures are described in the result.
     */
    public ConnectionProbeResult testConnection(EndpointDescriptor endpoint) {
        long start = System.nanoTime();
        try (Connection connection = open(endpoint);
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(settings.commandTimeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery(settings.probeQuery())) {
                if (!resultSet.next()) {
                    return ConnectionProbeResult.unreachable(
                        endpoint.id(), "Failed to execute test query", null, elapsedSince(start));
                }
                String version = resultSet.getMetaData().getColumnCount() > 1 ? resultSet.getString(2) : null;
                log.debug("Endpoint {} reachable, server version {}", endpoint.id(), version);
                return ConnectionProbeResult.reachable(endpoint.id(), version, elapsedSince(start));
            }
        } catch (ConnectionException e) {
            return describeFailure(endpoint, e.getCause(), start);
        } catch (SQLException | RuntimeException e) {
            return describeFailure(endpoint, e, start);
        }
    }

    /**
     * Probes every endpoint, at most {@link ConnectionSettings#probeConcurrency()} at a time.
     * Results are returned in the order of {@code endpoints}.
     */
    public List<ConnectionProbeResult> testAllConnections(List<EndpointDescriptor> endpoints) {
        if (endpoints.isEmpty()) {
            return List.of();
        }
        Semaphore permits = new Semaphore(settings.probeConcurrency());
        ExecutorService executor = Executors.newCachedThreadPool(new ProbeThreadFactory());
        try {
            List<CompletableFuture<ConnectionProbeResult>> futures = new ArrayList<>(endpoints.size());
            for (EndpointDescriptor endpoint : endpoints) {
                futures.add(CompletableFuture.supplyAsync(() -> probeWithPermit(permits, endpoint), executor));
            }
            List<ConnectionProbeResult> results = new ArrayList<>(futures.size());
            for (CompletableFuture<ConnectionProbeResult> future : futures) {
                results.add(future.join());
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private ConnectionProbeResult probeWithPermit(Semaphore permits, EndpointDescriptor endpoint) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConnectionProbeResult.unreachable(
                endpoint.id(), "Unexpected error: probe interrupted", null, Duration.ZERO);
        }
        try {
            return testConnection(endpoint);
        } finally {
            permits.release();
        }
    }

    private ConnectionProbeResult describeFailure(EndpointDescriptor endpoint, Throwable error, long start) {
        Duration duration = elapsedSince(start);
        SQLException sqlError = findSqlException(error);
        String message;
        if (sqlError instanceof SQLTimeoutException) {
            message = "Connection timeout: " + sqlError.getMessage();
        } else if (sqlError != null) {
            message = "Database error: " + sqlError.getMessage();
        } else {
            message = "Unexpected error: " + (error == null ? "unknown" : error.getMessage());
        }
        log.debug("Endpoint {} unreachable: {}", endpoint.id(), message);
        return ConnectionProbeResult.unreachable(
            endpoint.id(), message, sqlError == null ? null : sqlError.getSQLState(), duration);
    }

    private static SQLException findSqlException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            current = current.getCause();
        }
        return null;
    }

    private HikariDataSource pool(EndpointDescriptor endpoint) {
        return pools.computeIfAbsent(endpoint.id(), id -> createPool(endpoint));
    }

    private HikariDataSource createPool(EndpointDescriptor endpoint) {
        var config = new HikariConfig();
        config.setPoolName("multi-query-" + endpoint.id());
        config.setJdbcUrl(settings.jdbcUrl(endpoint));
        config.setUsername(endpoint.username());
        config.setPassword(endpoint.password());
        for (Map.Entry<String, String> property : settings.driverProperties().entrySet()) {
            config.addDataSourceProperty(property.getKey(), property.getValue());
        }
        config.setMinimumIdle(settings.minPoolSize());
        config.setMaximumPoolSize(settings.maxPoolSize());
        config.setConnectionTimeout(settings.connectTimeoutSeconds() * 1000L);
        config.setValidationTimeout(VALIDATION_TIMEOUT_MS);
        config.setLeakDetectionThreshold(LEAK_DETECTION_THRESHOLD_MS);
        config.setReadOnly(true);

        log.debug("Creating connection pool for endpoint {} ({}:{}/{})",
            endpoint.id(), endpoint.host(), endpoint.port(), endpoint.database());
        return new HikariDataSource(config);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        for (HikariDataSource dataSource : pools.values()) {
            if (!dataSource.isClosed()) {
                dataSource.close();
            }
        }
        pools.clear();
    }

    private static final class ProbeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "multi-query-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
