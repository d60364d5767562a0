package io.fleetquery.tools.multiquery;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Result of running the query against one endpoint. Either a {@link Success} carrying the
 * captured result set or a {@link Failure} carrying the reason; never both.
 */
public sealed interface QueryOutcome permits QueryOutcome.Success, QueryOutcome.Failure {

    String endpointId();

    Duration elapsed();

    boolean success();

    /** Column labels in result-set order; empty for failures. */
    List<String> columns();

    /** Row snapshots aligned with {@link #columns()}; values may be {@code null}. */
    List<List<Object>> rows();

    default int rowCount() {
        return rows().size();
    }

    static Success success(String endpointId, List<String> columns, List<List<Object>> rows, Duration elapsed) {
        return new Success(endpointId, columns, rows, elapsed);
    }

    static Failure failure(String endpointId, FailureKind kind, String errorMessage, Duration elapsed) {
        return new Failure(endpointId, kind, errorMessage, elapsed);
    }

    enum FailureKind {
        /** The endpoint could not be reached or authenticated. */
        CONNECTION,
        /** The guarded transaction or the query itself failed. */
        EXECUTION
    }

    record Success(String endpointId, List<String> columns, List<List<Object>> rows, Duration elapsed)
        implements QueryOutcome {

        public Success {
            Objects.requireNonNull(endpointId, "endpointId");
            Objects.requireNonNull(elapsed, "elapsed");
            columns = List.copyOf(columns);
            List<List<Object>> snapshot = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                List<Object> row = rows.get(i);
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException(
                        "Row " + (i + 1) + " has " + row.size() + " values but " + columns.size() + " columns");
                }
                // values may be null, so List.copyOf is not an option here
                snapshot.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
            rows = Collections.unmodifiableList(snapshot);
        }

        @Override
        public boolean success() {
            return true;
        }

        /**
         * Value of the named column in the given row, or {@code null} when the column is absent.
         */
        public Object valueOf(List<Object> row, String column) {
            return valueOf(row, column, 0);
        }

        /**
         * Value of the {@code occurrence}-th (zero-based) column carrying the given label, or
         * {@code null} when this outcome has fewer columns with that label.
         */
        public Object valueOf(List<Object> row, String column, int occurrence) {
            int seen = 0;
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).equals(column) && seen++ == occurrence) {
                    return row.get(i);
                }
            }
            return null;
        }
    }

    record Failure(String endpointId, FailureKind kind, String errorMessage, Duration elapsed)
        implements QueryOutcome {

        public Failure {
            Objects.requireNonNull(endpointId, "endpointId");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(elapsed, "elapsed");
            if (errorMessage == null || errorMessage.isBlank()) {
                errorMessage = "Unknown error (" + kind.name().toLowerCase(Locale.ROOT) + ")";
            }
        }

        @Override
        public boolean success() {
            return false;
        }

        @Override
        public List<String> columns() {
            return List.of();
        }

        @Override
        public List<List<Object>> rows() {
            return List.of();
        }
    }
}
