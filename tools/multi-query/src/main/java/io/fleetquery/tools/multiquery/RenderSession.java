package io.fleetquery.tools.multiquery;

import java.util.List;

/**
 * Per-invocation rendering state: whether the CSV header has been emitted, and which columns it named.
 * <p>
 * Not thread-safe; one session belongs to one sequence of render calls.
 */
public final class RenderSession {

    private boolean headersWritten;
    private List<String> csvColumns = List.of();

    public boolean headersWritten() {
        return headersWritten;
    }

    /**
     * Columns of the emitted CSV header, excluding {@code client_id}. Empty until the header is written.
     */
    public List<String> csvColumns() {
        return csvColumns;
    }

    void markHeadersWritten(List<String> columns) {
        if (headersWritten) {
            throw new IllegalStateException("CSV header already written for this session");
        }
        this.csvColumns = List.copyOf(columns);
        this.headersWritten = true;
    }
}
