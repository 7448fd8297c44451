package com.di.phenostore.util;

import com.di.phenostore.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation of identifiers and user-supplied SQL-like expressions before they
 * are placed into a query tree.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    /**
     * Unquoted SQL identifier: letter or underscore first, at most 63 characters
     * (the PostgreSQL limit).
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$"
    );

    /**
     * Statement terminators, comments and statement keywords. Expressions may use
     * AND/OR and string literals, so those are allowed here, unlike in identifiers.
     */
    private static final Pattern DANGEROUS_EXPRESSION_PATTERN = Pattern.compile(
            "(?i)(;|--|/\\*|\\*/|\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|GRANT|REVOKE|COPY|EXEC|EXECUTE|UNION|INTO|CALL)\\b)"
    );

    /** Single-quoted SQL string literals, with doubled quotes inside. */
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    /**
     * Validates an unquoted identifier (table name, column alias).
     *
     * @param identifier     the identifier to validate
     * @param identifierType type of identifier for error messages (e.g. "table name")
     * @return the trimmed identifier
     * @throws ValidationException if the identifier is empty or malformed
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException(String.format("%s cannot be empty", identifierType));
        }
        String trimmed = identifier.trim();
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException(String.format("Invalid %s format: '%s'. "
                    + "Must start with a letter or underscore, followed by letters, digits, underscores, "
                    + "or dollar signs (max 63 characters).", identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates a boolean predicate or value expression written by a query author.
     * Quoted literals are not inspected, so {@code c31_0_0 = 'drop'} is accepted.
     *
     * @return the trimmed expression
     * @throws ValidationException if the expression is empty, has unbalanced quotes,
     *                             or contains a statement-level construct
     */
    public static String validateExpression(String expression, String expressionType) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException(String.format("%s cannot be empty", expressionType));
        }
        String trimmed = expression.trim();
        String withoutLiterals = stripStringLiterals(trimmed);
        if (withoutLiterals.indexOf('\'') >= 0) {
            throw new ValidationException(String.format("Invalid %s: unbalanced quote in '%s'", expressionType, trimmed));
        }
        if (DANGEROUS_EXPRESSION_PATTERN.matcher(withoutLiterals).find()) {
            log.warn("Rejected {} with statement-level SQL: {}", expressionType, trimmed);
            throw new ValidationException(String.format(
                    "Invalid %s: only expressions over fields are allowed: '%s'", expressionType, trimmed));
        }
        return trimmed;
    }

    /** Blanks out every single-quoted literal. */
    public static String stripStringLiterals(String expression) {
        return STRING_LITERAL.matcher(expression).replaceAll(" ");
    }

    /**
     * Sanitizes a string for logging (masks JDBC URL passwords).
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        if (input.contains("password=")) {
            return input.replaceAll("password=[^;&]+", "password=***");
        }
        return input;
    }
}
