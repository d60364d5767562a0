package io.fleetquery.tools.multiquery;

import io.fleetquery.tools.multiquery.QueryOutcome.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a query against endpoints one at a time, in input order.
 * <p>
 * Each endpoint's outcome is delivered as soon as that endpoint finishes and before the next
 * one starts, so callers see outcomes in exactly the order of the endpoint list.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final ConnectionFactory connectionFactory;
    private final TransactionGuard transactionGuard;

    public ExecutionCoordinator(ConnectionFactory connectionFactory, TransactionGuard transactionGuard) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "Connection factory cannot be null");
        this.transactionGuard = Objects.requireNonNull(transactionGuard, "Transaction guard cannot be null");
    }

    public ExecutionCoordinator(ConnectionFactory connectionFactory) {
        this(connectionFactory, new TransactionGuard(connectionFactory.settings()));
    }

    /**
     * Streaming form: {@code onOutcome} is invoked once per endpoint, in input order.
     */
    public void run(String query, List<EndpointDescriptor> endpoints, Consumer<QueryOutcome> onOutcome) {
        Objects.requireNonNull(query, "Query cannot be null");
        Objects.requireNonNull(onOutcome, "Outcome callback cannot be null");
        for (EndpointDescriptor endpoint : endpoints) {
            onOutcome.accept(execute(query, endpoint));
        }
    }

    /**
     * Batch form: outcomes in input order.
     */
    public List<QueryOutcome> runBatch(String query, List<EndpointDescriptor> endpoints) {
        List<QueryOutcome> outcomes = new ArrayList<>(endpoints.size());
        run(query, endpoints, outcomes::add);
        return outcomes;
    }

    private QueryOutcome execute(String query, EndpointDescriptor endpoint) {
        log.debug("Executing query on endpoint {}", endpoint.id());
        long start = System.nanoTime();
        Connection connection;
        try {
            connection = connectionFactory.open(endpoint);
        } catch (ConnectionException e) {
            return QueryOutcome.failure(endpoint.id(), FailureKind.CONNECTION,
                e.getMessage(), Duration.ofNanos(System.nanoTime() - start));
        }
        try {
            QueryOutcome outcome = transactionGuard.runReadOnly(endpoint.id(), connection, query);
            log.debug("Endpoint {} finished: success={}, rows={}", endpoint.id(), outcome.success(), outcome.rowCount());
            return outcome;
        } finally {
            close(endpoint, connection);
        }
    }

    private static void close(EndpointDescriptor endpoint, Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Endpoint {}: failed to release connection: {}", endpoint.id(), e.getMessage(), e);
        }
    }
}
