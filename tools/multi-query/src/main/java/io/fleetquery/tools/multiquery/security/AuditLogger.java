package io.fleetquery.tools.multiquery.security;

import io.fleetquery.tools.multiquery.QueryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Appends one line per multi-query run: who ran which query against which endpoints, and how it went.
 * The query is recorded as a short preview plus a hash prefix so runs can be correlated.
 */
public class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final int HASH_PREFIX_LENGTH = 16;
    private static final int QUERY_PREVIEW_LENGTH = 200;
    private static final String HASH_ALGORITHM = "SHA-256";
    private static final String LOG_DELIMITER = "|";

    private final Path auditLog;

    public AuditLogger(Path auditLog) {
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log path cannot be null");
    }

    public void logRun(String query, List<QueryOutcome> outcomes) {
        String endpoints = outcomes.stream().map(QueryOutcome::endpointId).collect(Collectors.joining(","));
        long succeeded = outcomes.stream().filter(QueryOutcome::success).count();
        long rows = outcomes.stream().mapToLong(QueryOutcome::rowCount).sum();

        String logLine = String.join(LOG_DELIMITER,
            Instant.now().toString(),
            System.getProperty("user.name", "unknown"),
            endpoints,
            previewQuery(query),
            hashQuery(query),
            succeeded + "/" + outcomes.size(),
            Long.toString(rows)
        ) + System.lineSeparator();

        try {
            if (auditLog.getParent() != null) {
                Files.createDirectories(auditLog.getParent());
            }
            Files.write(auditLog, logLine.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log: " + auditLog, e);
        }
    }

    private String previewQuery(String query) {
        if (query == null) {
            return "";
        }
        // one physical line per entry; the delimiter must not appear inside a field
        String singleLine = query.replaceAll("\\s+", " ").replace(LOG_DELIMITER, "/").trim();
        if (singleLine.length() > QUERY_PREVIEW_LENGTH) {
            return singleLine.substring(0, QUERY_PREVIEW_LENGTH) + "...";
        }
        return singleLine;
    }

    private String hashQuery(String query) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(Objects.toString(query, "").getBytes(StandardCharsets.UTF_8));
            String encoded = Base64.getEncoder().encodeToString(hash);
            return encoded.substring(0, Math.min(HASH_PREFIX_LENGTH, encoded.length()));
        } catch (NoSuchAlgorithmException e) {
            log.warn("Hash algorithm not available: {}", e.getMessage());
            return "HASH_ERROR";
        }
    }
}
