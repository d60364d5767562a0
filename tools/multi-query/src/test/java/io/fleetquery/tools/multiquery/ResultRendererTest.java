package io.fleetquery.tools.multiquery;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.fleetquery.tools.multiquery.QueryOutcome.FailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultRenderer Tests")
class ResultRendererTest {

    private final ResultRenderer renderer = new ResultRenderer();

    private static QueryOutcome success(String id, List<String> columns, List<Object>... rows) {
        return QueryOutcome.success(id, columns, Arrays.asList(rows), Duration.ofMillis(12));
    }

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    @Nested
    @DisplayName("Table layout")
    class TableLayout {

        @Test
        @DisplayName("Should render status line, padded header, separator and rows")
        void shouldRenderTable() {
            QueryOutcome outcome = success("alpha", List.of("id", "name"), row(1, "Acme"), row(22, null));

            String table = renderer.renderOne(outcome, OutputMode.TABLE, new RenderSession());

            assertThat(table).isEqualTo(
                "[alpha] ✓ 2 rows (12ms)\n"
                    + "id | name\n"
                    + "---|-----\n"
                    + "1  | Acme\n"
                    + "22 | NULL\n"
                    + "\n");
        }

        @Test
        @DisplayName("Should use the singular for one row")
        void shouldUseSingular() {
            String table = renderer.renderTable(success("alpha", List.of("n"), row(1)));

            assertThat(table).startsWith("[alpha] ✓ 1 row (12ms)\n");
        }

        @Test
        @DisplayName("Should render only a status line for an empty result")
        void shouldRenderEmptyResult() {
            String table = renderer.renderTable(success("alpha", List.of("id")));

            assertThat(table).isEqualTo("[alpha] ✓ 0 rows (12ms)\n\n");
        }

        @Test
        @DisplayName("Should render a failure line")
        void shouldRenderFailure() {
            QueryOutcome failure = QueryOutcome.failure("beta", FailureKind.EXECUTION,
                "relation \"users\" does not exist", Duration.ofMillis(3));

            assertThat(renderer.renderTable(failure)).isEqualTo("[beta] ✗ relation \"users\" does not exist\n\n");
        }

        @Test
        @DisplayName("Should format timestamps, decimals, booleans and bytes")
        void shouldFormatValues() {
            QueryOutcome outcome = success("alpha", List.of("at", "amount", "flag", "raw"),
                row(Timestamp.valueOf(LocalDateTime.of(2024, 3, 9, 7, 5, 1)), new BigDecimal("1E+3"),
                    Boolean.TRUE, new byte[] {0x0a, (byte) 0xff}));

            String table = renderer.renderTable(outcome);

            assertThat(table).contains("2024-03-09 07:05:01 | 1000   | true | \\x0aff");
        }
    }

    @Nested
    @DisplayName("CSV layout")
    class CsvLayout {

        private ListAppender<ILoggingEvent> appender;
        private Logger logger;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(ResultRenderer.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(appender);
        }

        @Test
        @DisplayName("Should write the header once per session")
        void shouldWriteHeaderOnce() {
            RenderSession session = new RenderSession();

            String first = renderer.renderOne(success("alpha", List.of("id"), row(1)), OutputMode.CSV, session);
            String second = renderer.renderOne(success("beta", List.of("id"), row(2), row(3)), OutputMode.CSV, session);

            assertThat(first).isEqualTo("client_id,id\nalpha,1\n");
            assertThat(second).isEqualTo("beta,2\nbeta,3\n");
            assertThat(session.headersWritten()).isTrue();
            assertThat(session.csvColumns()).containsExactly("id");
        }

        @Test
        @DisplayName("Should take the header from the first outcome with rows")
        void shouldSkipEmptyAndFailedOutcomes() {
            RenderSession session = new RenderSession();
            QueryOutcome failed = QueryOutcome.failure("down", FailureKind.CONNECTION, "refused", Duration.ZERO);
            QueryOutcome empty = success("empty", List.of("other"));

            assertThat(renderer.renderOne(failed, OutputMode.CSV, session)).isEmpty();
            assertThat(renderer.renderOne(empty, OutputMode.CSV, session)).isEmpty();
            assertThat(session.headersWritten()).isFalse();

            String csv = renderer.renderOne(success("alpha", List.of("id"), row(1)), OutputMode.CSV, session);
            assertThat(csv).isEqualTo("client_id,id\nalpha,1\n");
        }

        @Test
        @DisplayName("Should match later rows to the header by column name")
        void shouldProjectByName() {
            List<QueryOutcome> outcomes = List.of(
                success("alpha", List.of("id", "name"), row(1, "Acme")),
                success("beta", List.of("name", "region"), row("Globex", "eu")));

            String csv = renderer.renderBatch(outcomes, OutputMode.CSV);

            assertThat(csv).isEqualTo("client_id,id,name\nalpha,1,Acme\nbeta,NULL,Globex\n");
            assertThat(appender.list)
                .anySatisfy(event -> assertThat(event.getFormattedMessage())
                    .contains("beta")
                    .contains("values are matched by name"));
        }

        @Test
        @DisplayName("Should keep every value when column labels repeat")
        void shouldKeepRepeatedLabels() {
            List<QueryOutcome> outcomes = List.of(
                success("alpha", List.of("id", "id"), row(1, 2)),
                success("beta", List.of("id", "id"), row(3, 4)));

            String csv = renderer.renderBatch(outcomes, OutputMode.CSV);

            assertThat(csv).isEqualTo("client_id,id,id\nalpha,1,2\nbeta,3,4\n");
        }

        @Test
        @DisplayName("Should pair repeated labels in order when layouts differ")
        void shouldPairRepeatedLabelsInOrder() {
            List<QueryOutcome> outcomes = List.of(
                success("alpha", List.of("id", "name", "id"), row(1, "Acme", 2)),
                success("beta", List.of("id", "id", "region"), row(3, 4, "eu")),
                success("gamma", List.of("name", "id"), row("Initech", 5)));

            String csv = renderer.renderBatch(outcomes, OutputMode.CSV);

            assertThat(csv).isEqualTo(
                "client_id,id,name,id\n"
                    + "alpha,1,Acme,2\n"
                    + "beta,3,NULL,4\n"
                    + "gamma,5,Initech,NULL\n");
        }

        @Test
        @DisplayName("Should render NULL for null values")
        void shouldRenderNull() {
            String csv = renderer.renderBatch(List.of(success("alpha", List.of("a", "b"), row(null, "x"))),
                OutputMode.CSV);

            assertThat(csv).isEqualTo("client_id,a,b\nalpha,NULL,x\n");
        }
    }

    @Test
    @DisplayName("Should render the same batch identically on every call")
    void shouldBeIdempotent() {
        List<QueryOutcome> outcomes = List.of(
            success("alpha", List.of("id"), row(1)),
            QueryOutcome.failure("beta", FailureKind.EXECUTION, "boom", Duration.ZERO),
            success("gamma", List.of("id"), row(3)));

        for (OutputMode mode : OutputMode.values()) {
            assertThat(renderer.renderBatch(outcomes, mode)).isEqualTo(renderer.renderBatch(outcomes, mode));
        }
        assertThat(renderer.renderBatch(outcomes, OutputMode.CSV)).isEqualTo("client_id,id\nalpha,1\ngamma,3\n");
    }

    @Test
    @DisplayName("Should render a batch exactly as a stream through one session")
    void shouldMatchStreaming() {
        List<QueryOutcome> outcomes = List.of(
            success("alpha", List.of("id"), row(1)),
            success("beta", List.of("id"), row(2)));
        RenderSession session = new RenderSession();
        StringBuilder streamed = new StringBuilder();
        for (QueryOutcome outcome : outcomes) {
            streamed.append(renderer.renderOne(outcome, OutputMode.CSV, session));
        }

        assertThat(renderer.renderBatch(outcomes, OutputMode.CSV)).isEqualTo(streamed.toString());
    }
}
