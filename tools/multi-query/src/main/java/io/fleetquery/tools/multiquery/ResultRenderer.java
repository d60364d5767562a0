package io.fleetquery.tools.multiquery;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats query outcomes as an aligned text table or as CSV.
 * <p>
 * CSV output has a single header, {@code client_id} followed by the columns of the first successful
 * outcome that returned rows. Rows of every later outcome are projected onto that header by column
 * name: missing columns render as {@code NULL}, extra columns are left out, and repeated labels
 * pair up in order. Outcomes whose columns equal the header are written positionally. Batch rendering streams
 * the list through one fresh {@link RenderSession}, so both modes produce identical text.
 */
public class ResultRenderer {

    private static final Logger log = LoggerFactory.getLogger(ResultRenderer.class);

    static final String LINE_SEPARATOR = "\n";
    static final String CLIENT_ID_COLUMN = "client_id";
    private static final String COLUMN_DELIMITER = " | ";
    private static final String SEPARATOR_DELIMITER = "-|-";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT
        .builder()
        .setRecordSeparator(LINE_SEPARATOR)
        .setQuoteMode(QuoteMode.MINIMAL)
        .build();

    public String renderBatch(List<QueryOutcome> outcomes, OutputMode mode) {
        RenderSession session = new RenderSession();
        StringBuilder out = new StringBuilder();
        for (QueryOutcome outcome : outcomes) {
            out.append(renderOne(outcome, mode, session));
        }
        return out.toString();
    }

    public String renderOne(QueryOutcome outcome, OutputMode mode, RenderSession session) {
        return mode == OutputMode.CSV ? renderCsv(outcome, session) : renderTable(outcome);
    }

    /**
     * One status line per outcome, then the rows as a padded table, then a blank line.
     */
    String renderTable(QueryOutcome outcome) {
        StringBuilder out = new StringBuilder();
        if (outcome instanceof QueryOutcome.Failure failure) {
            out.append('[').append(failure.endpointId()).append("] ✗ ").append(failure.errorMessage())
                .append(LINE_SEPARATOR);
        } else {
            int rowCount = outcome.rowCount();
            out.append('[').append(outcome.endpointId()).append("] ✓ ")
                .append(rowCount).append(rowCount == 1 ? " row" : " rows")
                .append(" (").append(outcome.elapsed().toMillis()).append("ms)")
                .append(LINE_SEPARATOR);
            if (rowCount > 0 && !outcome.columns().isEmpty()) {
                appendTable(out, outcome.columns(), outcome.rows());
            }
        }
        out.append(LINE_SEPARATOR);
        return out.toString();
    }

    private void appendTable(StringBuilder out, List<String> columns, List<List<Object>> rows) {
        List<List<String>> formatted = new ArrayList<>(rows.size());
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
        }
        for (List<Object> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                String cell = ValueFormatter.format(row.get(c));
                widths[c] = Math.max(widths[c], cell.length());
                cells.add(cell);
            }
            formatted.add(cells);
        }

        List<String> header = new ArrayList<>(columns.size());
        List<String> dashes = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            header.add(padRight(columns.get(c), widths[c]));
            dashes.add("-".repeat(widths[c]));
        }
        out.append(String.join(COLUMN_DELIMITER, header)).append(LINE_SEPARATOR);
        out.append(String.join(SEPARATOR_DELIMITER, dashes)).append(LINE_SEPARATOR);
        for (List<String> cells : formatted) {
            List<String> padded = new ArrayList<>(cells.size());
            for (int c = 0; c < cells.size(); c++) {
                padded.add(padRight(cells.get(c), widths[c]));
            }
            out.append(String.join(COLUMN_DELIMITER, padded)).append(LINE_SEPARATOR);
        }
    }

    /**
     * CSV rows for a successful outcome, preceded by the header the first time rows are seen.
     * Failures produce no CSV text.
     */
    String renderCsv(QueryOutcome outcome, RenderSession session) {
        if (!(outcome instanceof QueryOutcome.Success success) || success.rows().isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, CSV_FORMAT)) {
            if (!session.headersWritten()) {
                session.markHeadersWritten(success.columns());
                List<String> header = new ArrayList<>(success.columns().size() + 1);
                header.add(CLIENT_ID_COLUMN);
                header.addAll(success.columns());
                printer.printRecord(header);
            }

            List<String> columns = session.csvColumns();
            boolean sameLayout = columns.equals(success.columns());
            if (!sameLayout) {
                log.warn("Endpoint {} returned columns {} but the CSV header is {}; values are matched by name",
                    success.endpointId(), success.columns(), columns);
            }
            for (List<Object> row : success.rows()) {
                List<String> record = new ArrayList<>(columns.size() + 1);
                record.add(success.endpointId());
                if (sameLayout) {
                    for (Object value : row) {
                        record.add(ValueFormatter.format(value));
                    }
                } else {
                    // the n-th header column named x takes the n-th column named x of this outcome
                    Map<String, Integer> occurrences = new HashMap<>();
                    for (String column : columns) {
                        int occurrence = occurrences.merge(column, 1, Integer::sum) - 1;
                        record.add(ValueFormatter.format(success.valueOf(row, column, occurrence)));
                    }
                }
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV for endpoint " + success.endpointId(), e);
        }
        return out.toString();
    }

    private static String padRight(String value, int width) {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }
}
