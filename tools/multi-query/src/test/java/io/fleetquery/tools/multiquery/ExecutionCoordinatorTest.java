package io.fleetquery.tools.multiquery;

import io.fleetquery.tools.multiquery.QueryOutcome.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ExecutionCoordinator Unit Tests")
class ExecutionCoordinatorTest {

    private static final String QUERY = "SELECT 1 AS n";

    private static final EndpointDescriptor A = endpoint("A");
    private static final EndpointDescriptor B = endpoint("B");
    private static final EndpointDescriptor C = endpoint("C");

    @Mock
    private ConnectionFactory connectionFactory;
    @Mock
    private TransactionGuard transactionGuard;
    private Map<String, Connection> connections;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        connections = Map.of("A", mock(Connection.class), "B", mock(Connection.class), "C", mock(Connection.class));

        when(connectionFactory.open(any())).thenAnswer(call -> {
            EndpointDescriptor endpoint = call.getArgument(0);
            return connections.get(endpoint.id());
        });
        // A is slowest, C is fastest
        Map<String, Long> latencies = Map.of("A", 60L, "B", 30L, "C", 0L);
        when(transactionGuard.runReadOnly(anyString(), any(), eq(QUERY))).thenAnswer(call -> {
            String id = call.getArgument(0);
            Thread.sleep(latencies.get(id));
            return QueryOutcome.success(id, List.of("n"), List.of(List.of(1)), Duration.ofMillis(latencies.get(id)));
        });

        coordinator = new ExecutionCoordinator(connectionFactory, transactionGuard);
    }

    @Test
    @DisplayName("Should deliver outcomes in input order regardless of latency")
    void shouldPreserveInputOrder() {
        List<String> delivered = new ArrayList<>();

        coordinator.run(QUERY, List.of(A, B, C), outcome -> delivered.add(outcome.endpointId()));

        assertThat(delivered).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Should produce the same outcomes in batch and streaming form")
    void shouldMatchStreamingInBatch() {
        List<QueryOutcome> streamed = new ArrayList<>();
        coordinator.run(QUERY, List.of(C, A, B), streamed::add);

        List<QueryOutcome> batch = coordinator.runBatch(QUERY, List.of(C, A, B));

        assertThat(batch).extracting(QueryOutcome::endpointId).containsExactly("C", "A", "B");
        assertThat(batch).extracting(QueryOutcome::endpointId)
            .containsExactlyElementsOf(streamed.stream().map(QueryOutcome::endpointId).toList());
        assertThat(batch).extracting(QueryOutcome::rows)
            .containsExactlyElementsOf(streamed.stream().map(QueryOutcome::rows).toList());
    }

    @Test
    @DisplayName("Should report a connection failure without stopping the run")
    void shouldContinueAfterConnectionFailure() {
        when(connectionFactory.open(B)).thenThrow(new ConnectionException("B", "Connection refused", null));

        List<QueryOutcome> outcomes = coordinator.runBatch(QUERY, List.of(A, B, C));

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(1)).isInstanceOf(QueryOutcome.Failure.class);
        QueryOutcome.Failure failure = (QueryOutcome.Failure) outcomes.get(1);
        assertThat(failure.kind()).isEqualTo(FailureKind.CONNECTION);
        assertThat(failure.errorMessage()).isEqualTo("Connection refused");
        assertThat(outcomes.get(0).success()).isTrue();
        assertThat(outcomes.get(2).success()).isTrue();
        verify(transactionGuard, never()).runReadOnly(eq("B"), any(), anyString());
    }

    @Test
    @DisplayName("Should close every connection it opens")
    void shouldCloseConnections() throws Exception {
        coordinator.runBatch(QUERY, List.of(A, B, C));

        for (Connection connection : connections.values()) {
            verify(connection).close();
        }
    }

    @Test
    @DisplayName("Should keep the outcome when closing the connection fails")
    void shouldSurviveCloseFailure() throws Exception {
        doThrow(new SQLException("socket closed")).when(connections.get("A")).close();

        List<QueryOutcome> outcomes = coordinator.runBatch(QUERY, List.of(A));

        assertThat(outcomes).singleElement().satisfies(outcome -> assertThat(outcome.success()).isTrue());
    }

    @Test
    @DisplayName("Should produce no outcomes for an empty endpoint list")
    void shouldHandleEmptyEndpointList() {
        assertThat(coordinator.runBatch(QUERY, List.of())).isEmpty();
        verifyNoInteractions(connectionFactory, transactionGuard);
    }

    private static EndpointDescriptor endpoint(String id) {
        return new EndpointDescriptor(id, "localhost", 5432, "app", "reader", "secret");
    }
}
