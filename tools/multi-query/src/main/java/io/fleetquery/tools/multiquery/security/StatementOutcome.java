package io.fleetquery.tools.multiquery.security;

/**
 * Classification of a single statement.
 *
 * @param index 1-based position among the non-blank statements of the query
 * @param errorMessage {@code null} when the statement is allowed
 */
public record StatementOutcome(
    int index,
    String rawText,
    boolean valid,
    StatementType statementType,
    String errorMessage
) {
}
