package io.fleetquery.tools.multiquery.security;

import java.util.regex.Pattern;

/**
 * Safety category of one SQL statement, decided by its leading keyword.
 * Only {@link #SELECT} is permitted.
 * <p>
 * {@code SELECT} must be followed by whitespace; {@code SELECT*FROM t} and {@code SELECT(1)}
 * fall through to {@link #UNKNOWN} and are rejected.
 */
public enum StatementType {

    SELECT("Select", "SELECT\\s+", null),
    DML("Dml", "(INSERT|UPDATE|DELETE|MERGE)\\b",
        "DML operations (INSERT, UPDATE, DELETE, MERGE) are not allowed"),
    DDL("Ddl", "(CREATE|ALTER|DROP|TRUNCATE|RENAME)\\b",
        "DDL operations (CREATE, ALTER, DROP, TRUNCATE, RENAME) are not allowed"),
    TRANSACTION_CONTROL("TransactionControl", "(BEGIN|COMMIT|ROLLBACK|START\\s+TRANSACTION)\\b",
        "Transaction control statements are not allowed"),
    PROCEDURE("Procedure", "(CALL|EXEC|EXECUTE)\\b",
        "Procedure calls are not allowed"),
    UNKNOWN("Unknown", null,
        "Unknown or unsupported SQL statement type");

    private final String displayName;
    private final Pattern leadingKeyword;
    private final String rejection;

    StatementType(String displayName, String leadingKeyword, String rejection) {
        this.displayName = displayName;
        this.leadingKeyword = leadingKeyword == null
            ? null
            : Pattern.compile("\\s*" + leadingKeyword, Pattern.CASE_INSENSITIVE);
        this.rejection = rejection;
    }

    public String displayName() {
        return displayName;
    }

    public boolean allowed() {
        return this == SELECT;
    }

    /**
     * Why statements of this type are rejected; {@code null} for {@link #SELECT}.
     */
    public String rejection() {
        return rejection;
    }

    /**
     * Matches the leading keyword of comment-free statement text. Never returns {@code null}.
     */
    static StatementType ofLeadingKeyword(String statement) {
        for (StatementType type : values()) {
            if (type.leadingKeyword != null && type.leadingKeyword.matcher(statement).lookingAt()) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
