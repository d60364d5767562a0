package io.fleetquery.tools.multiquery;

import io.fleetquery.tools.multiquery.QueryOutcome.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one query inside a database-enforced read-only transaction.
 * <p>
 * The read-only directive is the first statement of the transaction, the caller's query runs
 * after it, and the transaction is always rolled back. Nothing executed here is ever committed.
 */
public class TransactionGuard {

    private static final Logger log = LoggerFactory.getLogger(TransactionGuard.class);

    private final ConnectionSettings settings;

    public TransactionGuard(ConnectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    /**
     * Executes {@code query} on {@code connection} and captures the first result set.
     * All failures are returned as {@link QueryOutcome.Failure}; this method does not throw.
     */
    public QueryOutcome runReadOnly(String endpointId, Connection connection, String query) {
        long start = System.nanoTime();
        try {
            try {
                beginReadOnly(connection);
                ResultSnapshot snapshot = execute(endpointId, connection, query);
                return QueryOutcome.success(endpointId, snapshot.columns(), snapshot.rows(), elapsedSince(start));
            } finally {
                rollback(endpointId, connection);
            }
        } catch (SQLException e) {
            return QueryOutcome.failure(endpointId, FailureKind.EXECUTION, describe(e), elapsedSince(start));
        } catch (RuntimeException e) {
            log.debug("Unexpected failure on endpoint {}", endpointId, e);
            return QueryOutcome.failure(endpointId, FailureKind.EXECUTION,
                "Unexpected error: " + e.getMessage(), elapsedSince(start));
        }
    }

    private void beginReadOnly(Connection connection) throws SQLException {
        connection.setReadOnly(true);
        connection.setAutoCommit(false);
        if (settings.hasReadOnlyDirective()) {
            try (Statement directive = connection.createStatement()) {
                directive.setQueryTimeout(settings.commandTimeoutSeconds());
                directive.execute(settings.readOnlyDirective());
            }
            log.debug("Read-only directive issued: {}", settings.readOnlyDirective());
        }
    }

    private ResultSnapshot execute(String endpointId, Connection connection, String query) throws SQLException {
        try (Statement statement = connection.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            statement.setQueryTimeout(settings.commandTimeoutSeconds());
            statement.setFetchSize(settings.fetchSize());

            boolean hasResultSet = statement.execute(query);
            ResultSnapshot snapshot = hasResultSet ? capture(statement.getResultSet()) : null;
            if (snapshot == null) {
                throw new SQLException("Query did not produce a result set");
            }
            discardRemainingResults(endpointId, statement);
            return snapshot;
        }
    }

    private ResultSnapshot capture(ResultSet resultSet) throws SQLException {
        try (resultSet) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(metaData.getColumnLabel(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    Object value = resultSet.getObject(i);
                    row.add(resultSet.wasNull() ? null : value);
                }
                rows.add(row);
            }
            return new ResultSnapshot(columns, rows);
        }
    }

    private void discardRemainingResults(String endpointId, Statement statement) throws SQLException {
        int discarded = 0;
        while (true) {
            boolean nextIsResultSet = statement.getMoreResults();
            if (!nextIsResultSet && statement.getUpdateCount() == -1) {
                break;
            }
            discarded++;
        }
        if (discarded > 0) {
            log.warn("Endpoint {}: discarded {} additional result(s); only the first result set is reported",
                endpointId, discarded);
        }
    }

    private void rollback(String endpointId, Connection connection) {
        try {
            connection.rollback();
            log.debug("Endpoint {}: read-only transaction rolled back", endpointId);
        } catch (SQLException e) {
            // the connection is discarded by the caller; an uncommitted transaction dies with it
            log.warn("Endpoint {}: rollback failed: {}", endpointId, e.getMessage(), e);
        }
    }

    private static String describe(SQLException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        String state = e.getSQLState();
        return state == null || message.contains(state) ? message : message + " (SQLSTATE " + state + ")";
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record ResultSnapshot(List<String> columns, List<List<Object>> rows) {
    }
}
