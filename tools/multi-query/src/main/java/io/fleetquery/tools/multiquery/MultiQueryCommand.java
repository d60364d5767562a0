package io.fleetquery.tools.multiquery;

import ch.qos.logback.classic.Level;
import io.fleetquery.tools.multiquery.security.AuditLogger;
import io.fleetquery.tools.multiquery.security.FilePermissionValidator;
import io.fleetquery.tools.multiquery.security.StatementClassifier;
import io.fleetquery.tools.multiquery.security.ValidationOutcome;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Multi-Query Command-Line Tool
 *
 * Runs one read-only SQL script against every database listed in an environments file
 * and prints the per-database results as a table or as CSV.
 */
@Command(
    name = "multi-query",
    version = "1.0.0",
    description = "Execute a read-only SQL query against multiple PostgreSQL databases",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = MultiQueryCommand.EXIT_VALIDATION,
    headerHeading = "%n@|bold,underline FleetQuery Multi-Query Tool|@%n%n",
    descriptionHeading = "%n@|bold Description:|@%n",
    parameterListHeading = "%n@|bold Parameters:|@%n",
    optionListHeading = "%n@|bold Options:|@%n",
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  Table output using ./environments.json:",
        "    multi-query queries/active-users.sql",
        "",
        "  CSV output to a file, explicit environments file:",
        "    multi-query -e prod-environments.json --csv queries/balances.sql > balances.csv",
        "",
        "  Full diagnostics and an audit trail:",
        "    multi-query -v --audit-log ~/.multi-query-audit.log queries/check.sql",
        ""
    }
)
public class MultiQueryCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_VALIDATION = 1;
    public static final int EXIT_NO_REACHABLE_ENDPOINT = 2;
    public static final int EXIT_UNEXPECTED = 3;

    private static final String LOGGER_ROOT = "io.fleetquery";

    @Parameters(
        index = "0",
        paramLabel = "<queryFile>",
        description = "Path to the SQL query file to execute"
    )
    private String queryFile;

    @Option(
        names = {"-e", "--environments-file"},
        description = "JSON file with the database environments (default: ${DEFAULT-VALUE}); "
            + "relative paths fall back to the install directory",
        defaultValue = "environments.json"
    )
    private String environmentsFile;

    @Option(
        names = {"-c", "--csv"},
        description = "Output results in CSV format (diagnostics go to stderr)"
    )
    private boolean csvOutput;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output with additional diagnostic information"
    )
    private boolean verbose;

    @Option(
        names = {"--fetch-size"},
        description = "JDBC fetch size (default: ${DEFAULT-VALUE})",
        defaultValue = "1000"
    )
    private int fetchSize;

    @Option(
        names = {"--command-timeout"},
        description = "Per-statement timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "60"
    )
    private int commandTimeoutSeconds;

    @Option(
        names = {"--probe-concurrency"},
        description = "Maximum simultaneous connection tests (default: ${DEFAULT-VALUE})",
        defaultValue = "5"
    )
    private int probeConcurrency;

    @Option(
        names = {"--audit-log"},
        description = "Append an audit entry for this run to the given file"
    )
    private Path auditLogPath;

    private final PrintStream stdout;
    private final PrintStream stderr;
    private final PathResolver pathResolver;

    public MultiQueryCommand() {
        this(System.out, System.err, new PathResolver());
    }

    MultiQueryCommand(PrintStream stdout, PrintStream stderr, PathResolver pathResolver) {
        this.stdout = stdout;
        this.stderr = stderr;
        this.pathResolver = pathResolver;
    }

    @Override
    public Integer call() {
        configureLogging();
        // in CSV mode stdout carries nothing but CSV
        ConsoleReporter reporter = new ConsoleReporter(csvOutput ? stderr : stdout, verbose);
        try {
            ConnectionSettings settings = buildSettings();

            Path resolvedQueryFile = pathResolver.resolveExisting(queryFile, "query file");
            Path resolvedEnvironmentsFile = pathResolver.resolveEnvironmentsFile(environmentsFile);
            reporter.parsedArguments(queryFile, environmentsFile, csvOutput);
            reporter.pathResolution("Query File", queryFile, resolvedQueryFile, pathResolver, false);
            reporter.pathResolution("Environments File", environmentsFile, resolvedEnvironmentsFile, pathResolver, true);
            reporter.info("✓ All required files exist and paths resolved");
            reporter.info("");

            EnvironmentConfig environments = new EnvironmentLoader().load(resolvedEnvironmentsFile);
            new FilePermissionValidator().check(resolvedEnvironmentsFile)
                .ifPresent(warning -> reporter.info("Warning: " + warning));
            reporter.environments(environments);

            String query = new QueryFileReader().read(resolvedQueryFile);
            reporter.queryContent(query, resolvedQueryFile);

            ValidationOutcome validation = new StatementClassifier().validate(query);
            reporter.validation(validation);
            if (!validation.valid()) {
                stderr.println("Query validation failed. Only SELECT statements are allowed.");
                return EXIT_VALIDATION;
            }

            try (ConnectionFactory connectionFactory = new ConnectionFactory(settings)) {
                List<ConnectionProbeResult> probes = connectionFactory.testAllConnections(environments.environments());
                reporter.connectionResults(probes);

                List<EndpointDescriptor> reachable = reachableEndpoints(environments.environments(), probes);
                int failed = environments.count() - reachable.size();
                if (failed > 0) {
                    reporter.info("Warning: " + failed + " database connection(s) failed.");
                    if (!verbose) {
                        reporter.info("Use --verbose flag to see detailed error information.");
                    }
                }
                if (reachable.isEmpty()) {
                    stderr.println("✗ No reachable database endpoints");
                    return EXIT_NO_REACHABLE_ENDPOINT;
                }
                if (failed > 0) {
                    reporter.info("Proceeding with available connections...");
                    reporter.info("");
                }

                reporter.info("=== Query Results: " + resolvedQueryFile.getFileName() + " ===");
                reporter.info("Executing against " + reachable.size() + " database(s)...");
                reporter.info("");

                List<QueryOutcome> outcomes = execute(new ExecutionCoordinator(connectionFactory), query, reachable);
                reporter.info("Query execution complete!");
                writeAuditEntry(query, outcomes);
            }
            return EXIT_OK;

        } catch (ValidationException e) {
            stderr.println("✗ Validation error: " + e.getMessage());
            return EXIT_VALIDATION;
        } catch (Exception e) {
            stderr.println("✗ Unexpected error: " + e.getMessage());
            if (verbose) {
                stderr.println("\nDetails:");
                e.printStackTrace(stderr);
            } else {
                stderr.println("(Use -v for detailed error information)");
            }
            return EXIT_UNEXPECTED;
        }
    }

    private List<QueryOutcome> execute(ExecutionCoordinator coordinator, String query,
                                       List<EndpointDescriptor> endpoints) {
        OutputMode mode = OutputMode.of(csvOutput);
        ResultRenderer renderer = new ResultRenderer();
        RenderSession session = new RenderSession();
        List<QueryOutcome> outcomes = new ArrayList<>(endpoints.size());

        coordinator.run(query, endpoints, outcome -> {
            outcomes.add(outcome);
            stdout.print(renderer.renderOne(outcome, mode, session));
            stdout.flush();
            if (mode == OutputMode.CSV && outcome instanceof QueryOutcome.Failure failure) {
                stderr.println("[" + failure.endpointId() + "] ✗ " + failure.errorMessage());
            }
        });
        return outcomes;
    }

    private ConnectionSettings buildSettings() {
        try {
            return ConnectionSettings.builder()
                .fetchSize(fetchSize)
                .commandTimeoutSeconds(commandTimeoutSeconds)
                .probeConcurrency(probeConcurrency)
                .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    private static List<EndpointDescriptor> reachableEndpoints(List<EndpointDescriptor> endpoints,
                                                               List<ConnectionProbeResult> probes) {
        Set<String> reachableIds = probes.stream()
            .filter(ConnectionProbeResult::success)
            .map(ConnectionProbeResult::endpointId)
            .collect(Collectors.toSet());
        return endpoints.stream()
            .filter(endpoint -> reachableIds.contains(endpoint.id()))
            .toList();
    }

    private void writeAuditEntry(String query, List<QueryOutcome> outcomes) {
        if (auditLogPath == null) {
            return;
        }
        try {
            new AuditLogger(auditLogPath).logRun(query, outcomes);
        } catch (UncheckedIOException e) {
            stderr.println("WARNING: Audit logging failed: " + e.getMessage());
        }
    }

    private void configureLogging() {
        if (verbose && LoggerFactory.getLogger(LOGGER_ROOT) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MultiQueryCommand())
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
            .execute(args);
        System.exit(exitCode);
    }
}
