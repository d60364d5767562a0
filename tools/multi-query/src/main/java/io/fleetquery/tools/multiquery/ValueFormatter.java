package io.fleetquery.tools.multiquery;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Turns captured column values into display text. Shared by the table and CSV layouts.
 */
final class ValueFormatter {

    static final String NULL_MARKER = "NULL";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueFormatter() {
    }

    static String format(Object value) {
        if (value == null) {
            return NULL_MARKER;
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return TIMESTAMP.format(timestamp.toLocalDateTime());
        }
        if (value instanceof java.sql.Date date) {
            return TIMESTAMP.format(date.toLocalDate().atStartOfDay());
        }
        if (value instanceof java.sql.Time time) {
            return time.toString();
        }
        if (value instanceof java.util.Date date) {
            return TIMESTAMP.format(LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault()));
        }
        if (value instanceof LocalDateTime dateTime) {
            return TIMESTAMP.format(dateTime);
        }
        if (value instanceof LocalDate date) {
            return TIMESTAMP.format(date.atStartOfDay());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return TIMESTAMP.format(dateTime.toLocalDateTime());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return TIMESTAMP.format(dateTime.toLocalDateTime());
        }
        if (value instanceof Instant instant) {
            return TIMESTAMP.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof byte[] bytes) {
            return "\\x" + HexFormat.of().formatHex(bytes);
        }
        return value.toString();
    }
}
