package io.fleetquery.tools.multiquery;

import io.fleetquery.tools.multiquery.security.StatementOutcome;
import io.fleetquery.tools.multiquery.security.ValidationOutcome;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Prints the progress sections of a run. Detail lines appear only in verbose mode.
 */
class ConsoleReporter {

    private static final int PREVIEW_LINES = 3;
    private static final int STATEMENT_PREVIEW_LENGTH = 50;
    private static final String RULE = "-".repeat(50);

    private final PrintStream out;
    private final boolean verbose;

    ConsoleReporter(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    void info(String message) {
        out.println(message);
    }

    void verbose(String message) {
        if (verbose) {
            out.println(message);
        }
    }

    void parsedArguments(String queryFile, String environmentsFile, boolean csv) {
        out.println("=== MultiQuery - Parsed Arguments ===");
        out.println("Query File: " + queryFile);
        out.println("Environments File: " + environmentsFile);
        out.println("CSV Output: " + csv);
        out.println("Verbose Mode: " + verbose);
        out.println();
    }

    void pathResolution(String description, String originalPath, Path resolved, PathResolver resolver,
                        boolean environmentsFile) {
        if (!verbose) {
            return;
        }
        boolean relative = !Path.of(originalPath).isAbsolute();
        out.println("=== Path Resolution: " + description + " ===");
        out.println("Original path: " + originalPath);
        out.println("Path type: " + (relative ? "Relative" : "Absolute"));
        out.println("Current working directory: " + resolver.workingDirectory());
        if (environmentsFile && relative) {
            List<Path> locations = resolver.environmentsSearchLocations(originalPath);
            out.println("Search locations:");
            out.println("  1. Current directory: " + locations.get(0) + " " + mark(Files.isRegularFile(locations.get(0))));
            out.println("  2. Install directory: " + locations.get(1) + " " + mark(Files.isRegularFile(locations.get(1))));
            out.println("Application install directory: " + resolver.installDirectory());
        }
        out.println("Resolved path: " + resolved);
        out.println("File exists: " + Files.isRegularFile(resolved));
        out.println();
    }

    void environments(EnvironmentConfig config) {
        out.println("=== Loaded " + config.count() + " Database Environment(s) ===");
        List<EndpointDescriptor> environments = config.environments();
        for (int i = 0; i < environments.size(); i++) {
            EndpointDescriptor env = environments.get(i);
            out.printf("%02d. %s%n", i + 1, env);
            verbose("    Connection: " + env.displayUri());
        }
        out.println();
    }

    void queryContent(String query, Path file) {
        String[] lines = query.split("\n", -1);
        long nonEmpty = Arrays.stream(lines).filter(line -> !line.isBlank()).count();

        out.println("=== SQL Query File: " + file.getFileName() + " ===");
        out.println("File Size: " + fileSize(file) + " bytes");
        out.println("Total Lines: " + lines.length + ", Non-empty Lines: " + nonEmpty);

        if (verbose) {
            out.println("Query Content:");
            out.println(RULE);
            for (int i = 0; i < lines.length; i++) {
                out.printf("%3d: %s%n", i + 1, lines[i]);
            }
            out.println(RULE);
        } else {
            List<String> preview = Arrays.stream(lines)
                .limit(PREVIEW_LINES)
                .filter(line -> !line.isBlank())
                .toList();
            if (!preview.isEmpty()) {
                out.println("Preview:");
                preview.forEach(line -> out.println("  " + line.trim()));
                if (lines.length > PREVIEW_LINES) {
                    out.println("  ... (use --verbose to see full content)");
                }
            }
        }
        out.println();
    }

    void validation(ValidationOutcome result) {
        out.println("=== Query Validation Results ===");
        out.println("Valid: " + (result.valid() ? "✓ Yes" : "✗ No"));
        out.println("Statements Found: " + result.statementCount());
        if (!result.valid()) {
            out.println("Error: " + result.errorMessage());
        }
        if (verbose && !result.statements().isEmpty()) {
            out.println();
            out.println("Statement Details:");
            for (StatementOutcome statement : result.statements()) {
                out.println("  " + mark(statement.valid()) + " Statement " + statement.index() + ": "
                    + statement.statementType().displayName());
                if (!statement.valid()) {
                    out.println("    Error: " + statement.errorMessage());
                }
                out.println("    Preview: " + preview(statement.rawText()));
            }
        }
        if (result.valid() && result.statementCount() > 1) {
            out.println("Note: " + result.statementCount()
                + " statements found; only the first statement's result set is reported per database.");
        }
        out.println();
    }

    void connectionResults(List<ConnectionProbeResult> results) {
        long successful = results.stream().filter(ConnectionProbeResult::success).count();
        out.println("=== Database Connection Test Results ===");
        out.println("Total: " + results.size() + ", Successful: " + successful
            + ", Failed: " + (results.size() - successful));
        out.println();

        results.stream()
            .sorted(Comparator.comparing(ConnectionProbeResult::endpointId))
            .forEach(result -> {
                out.printf("%s %-15s (%6s) - %s%n",
                    mark(result.success()),
                    result.endpointId(),
                    result.duration().toMillis() + "ms",
                    result.message());
                if (verbose && result.success() && result.serverVersion() != null) {
                    out.println("    Server Version: " + shortVersion(result.serverVersion()));
                }
                if (verbose && !result.success() && result.errorCode() != null) {
                    out.println("    Error Code: " + result.errorCode());
                }
            });
        out.println();
    }

    private static String shortVersion(String serverVersion) {
        // "PostgreSQL 15.4 on x86_64..." -> "15.4"
        String[] parts = serverVersion.trim().split("\\s+");
        return parts.length > 1 ? parts[1] : parts[0];
    }

    private static String preview(String statement) {
        String flat = statement.replace('\n', ' ').replace('\r', ' ');
        return flat.length() > STATEMENT_PREVIEW_LENGTH ? flat.substring(0, STATEMENT_PREVIEW_LENGTH) + "..." : flat;
    }

    private static long fileSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + file, e);
        }
    }

    private static String mark(boolean ok) {
        return ok ? "✓" : "✗";
    }
}
