package org.pseudoforge.compiler.backend.emit;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the emitters. Expressions themselves are passed through unchanged.
 */
public final class Expressions {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private Expressions() {
        // Utility class
    }

    /**
     * Checks if a message is exactly one string literal, e.g. {@code "Hello"} or {@code 'Hi'}.
     * {@code "a" + b} is an expression, not a literal.
     *
     * @param text The message.
     * @return true for a single quoted literal.
     */
    public static boolean isQuotedLiteral(String text) {
        if (text.length() < 2) {
            return false;
        }
        char quote = text.charAt(0);
        if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
            return false;
        }
        int i = 1;
        while (i < text.length() - 1) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return false;
            } else {
                i++;
            }
        }
        // an escape that swallowed the closing quote leaves i past it
        return i == text.length() - 1;
    }

    /**
     * Returns the content of a quoted literal in double-quoted form, with escapes kept.
     * A single-quoted literal has its {@code \'} unescaped and its bare {@code "} escaped.
     *
     * @param literal A text for which {@link #isQuotedLiteral(String)} holds.
     * @return The literal as {@code "..."}.
     */
    public static String toDoubleQuoted(String literal) {
        if (literal.charAt(0) == '"') {
            return literal;
        }
        String inner = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                char next = inner.charAt(++i);
                if (next == '\'') {
                    sb.append('\'');
                } else {
                    sb.append('\\').append(next);
                }
            } else if (c == '"') {
                sb.append("\\\"");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Strips the comment markers of a comment line.
     * @param sourceLine The comment as written, e.g. {@code /* note *}{@code /}.
     * @return The bare comment text.
     */
    public static String commentText(String sourceLine) {
        String text = sourceLine.strip();
        if (text.startsWith("//")) {
            text = text.substring(2);
        } else if (text.startsWith("/*")) {
            text = text.substring(2);
            if (text.endsWith("*/")) {
                text = text.substring(0, text.length() - 2);
            }
        } else if (text.startsWith("#")) {
            text = text.substring(1);
        }
        return text.strip();
    }

    /**
     * @param expr An expression.
     * @return The value if the expression is an integer literal.
     */
    public static Optional<Long> integerLiteral(String expr) {
        String s = expr.strip();
        if (!INTEGER.matcher(s).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(s.startsWith("+") ? s.substring(1) : s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @param step A FOR step expression.
     * @return true if the step is a negative integer literal, so the loop counts down.
     */
    public static boolean isDescending(String step) {
        return integerLiteral(step).map(v -> v < 0).orElse(false);
    }

    /**
     * @param step A FOR step expression.
     * @return The absolute step as text: the literal's magnitude, or the expression itself.
     */
    public static String stepMagnitude(String step) {
        return integerLiteral(step).map(v -> BigInteger.valueOf(v).abs().toString()).orElse(step.strip());
    }

    /**
     * Adds a constant to an expression, folding integer literals. Folding does not wrap around,
     * so {@code 9223372036854775807 + 1} folds to {@code 9223372036854775808}.
     * @param expr The expression.
     * @param delta The constant.
     * @return {@code expr + delta} as text.
     */
    public static String plus(String expr, long delta) {
        Optional<Long> literal = integerLiteral(expr);
        if (literal.isPresent()) {
            return BigInteger.valueOf(literal.get()).add(BigInteger.valueOf(delta)).toString();
        }
        if (delta == 0) {
            return expr;
        }
        return delta > 0 ? expr + " + " + delta : expr + " - " + (-delta);
    }

    /**
     * @param target An assignment target.
     * @return true if the target is a bare name, not an indexed or dotted access.
     */
    public static boolean isPlainIdentifier(String target) {
        return IDENTIFIER.matcher(target).matches();
    }

    /**
     * @param condition A parsed condition, possibly empty.
     * @param fallback  The target's false literal.
     * @return The condition, or the fallback if it is empty.
     */
    public static String conditionOr(String condition, String fallback) {
        return condition == null || condition.isBlank() ? fallback : condition;
    }
}
