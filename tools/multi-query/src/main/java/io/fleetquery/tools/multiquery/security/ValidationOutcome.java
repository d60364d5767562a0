package io.fleetquery.tools.multiquery.security;

import java.util.List;

/**
 * Verdict on a whole query: valid only if every statement is a SELECT and there is at least one.
 *
 * @param errorMessage first problem found, {@code null} when valid
 */
public record ValidationOutcome(
    boolean valid,
    String errorMessage,
    int statementCount,
    List<StatementOutcome> statements
) {

    public ValidationOutcome {
        statements = List.copyOf(statements);
    }

    static ValidationOutcome rejected(String errorMessage) {
        return new ValidationOutcome(false, errorMessage, 0, List.of());
    }
}
