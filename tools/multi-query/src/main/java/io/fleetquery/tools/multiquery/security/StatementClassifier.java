package io.fleetquery.tools.multiquery.security;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical gate that admits only SELECT statements.
 * <p>
 * Line ({@code --}) and block comments are removed, the remaining text is split on {@code ;}
 * and every non-blank statement is classified by its leading keyword. Quoted text (string
 * literals, quoted identifiers and dollar-quoted bodies) is opaque to both steps, so a
 * {@code --} or {@code ;} inside a literal neither starts a comment nor ends a statement. Classification is
 * fail-closed: anything that is not recognisably a SELECT is rejected. This is the first line of
 * defence only; execution additionally happens in a read-only transaction.
 */
public class StatementClassifier {

    static final int MAX_QUERY_LENGTH = 1_000_000;

    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$(?:[A-Za-z_][A-Za-z_0-9]*)?\\$");

    public ValidationOutcome validate(String queryText) {
        if (queryText == null) {
            return ValidationOutcome.rejected("Query contains only comments or whitespace");
        }
        if (queryText.length() > MAX_QUERY_LENGTH) {
            return ValidationOutcome.rejected("Query exceeds maximum length of " + MAX_QUERY_LENGTH + " characters");
        }

        String cleaned = stripComments(queryText);
        if (cleaned.isBlank()) {
            return ValidationOutcome.rejected("Query contains only comments or whitespace");
        }

        List<String> statements = split(cleaned);
        List<StatementOutcome> outcomes = new ArrayList<>(statements.size());
        String firstError = null;
        boolean anySelect = false;

        // every statement is classified, even after the first rejection, so diagnostics are complete
        for (int i = 0; i < statements.size(); i++) {
            StatementOutcome outcome = classifyStatement(statements.get(i), i + 1);
            outcomes.add(outcome);
            if (!outcome.valid() && firstError == null) {
                firstError = outcome.errorMessage();
            }
            anySelect |= outcome.statementType() == StatementType.SELECT;
        }

        if (firstError == null && !anySelect) {
            firstError = "No valid SELECT statements found in query";
        }
        return new ValidationOutcome(firstError == null, firstError, statements.size(), outcomes);
    }

    /**
     * Category of a single statement; comments are ignored.
     */
    public StatementType classify(String statementText) {
        return StatementType.ofLeadingKeyword(stripComments(statementText).trim());
    }

    /**
     * Replaces every comment with a single space so adjacent tokens stay separated.
     * An unterminated block comment runs to the end of the text.
     */
    public static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int quotedEnd = quotedEnd(text, i);
            if (quotedEnd > i) {
                out.append(text, i, quotedEnd);
                i = quotedEnd;
            } else if (text.startsWith("--", i)) {
                while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                    i++;
                }
                out.append(' ');
            } else if (text.startsWith("/*", i)) {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
                out.append(' ');
            } else {
                out.append(text.charAt(i++));
            }
        }
        return out.toString();
    }

    private StatementOutcome classifyStatement(String statement, int index) {
        StatementType type = StatementType.ofLeadingKeyword(statement);
        if (type.allowed()) {
            return new StatementOutcome(index, statement, true, type, null);
        }
        return new StatementOutcome(index, statement, false, type,
            "Statement " + index + ": " + type.rejection());
    }

    private static List<String> split(String cleaned) {
        List<String> statements = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < cleaned.length()) {
            int quotedEnd = quotedEnd(cleaned, i);
            if (quotedEnd > i) {
                i = quotedEnd;
            } else if (cleaned.charAt(i) == ';') {
                addStatement(statements, cleaned.substring(start, i));
                start = ++i;
            } else {
                i++;
            }
        }
        addStatement(statements, cleaned.substring(start));
        return statements;
    }

    private static void addStatement(List<String> statements, String candidate) {
        String trimmed = candidate.trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }

    /**
     * End index (exclusive) of the quoted section starting at {@code start}, or {@code start}
     * when no quote starts there. Unterminated quotes run to the end of the text; doubled quote
     * characters inside a literal are handled by re-entering the scan.
     */
    private static int quotedEnd(String text, int start) {
        char c = text.charAt(start);
        if (c == '\'' || c == '"') {
            int close = text.indexOf(c, start + 1);
            return close < 0 ? text.length() : close + 1;
        }
        // a '$' inside an identifier such as a$b is not a dollar quote
        if (c == '$' && (start == 0 || !Character.isJavaIdentifierPart(text.charAt(start - 1)))) {
            Matcher tag = DOLLAR_TAG.matcher(text).region(start, text.length());
            if (tag.lookingAt()) {
                int close = text.indexOf(tag.group(), tag.end());
                return close < 0 ? text.length() : close + tag.group().length();
            }
        }
        return start;
    }
}
