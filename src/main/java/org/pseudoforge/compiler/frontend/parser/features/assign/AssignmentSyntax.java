package org.pseudoforge.compiler.frontend.parser.features.assign;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lexical helpers for assignments: locating the operator and validating targets.
 */
public final class AssignmentSyntax {

    /** An identifier, optionally indexed ({@code a[i]}) or dotted ({@code p.x}). */
    private static final Pattern TARGET =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\[[^\\]]*]|\\.[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern PREFIX = Pattern.compile("(?i)^(?:SET|LET)(?:\\s+|$)");
    private static final Pattern BASE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*");

    private AssignmentSyntax() {
        // Utility class
    }

    /**
     * The position and spelling of an assignment operator.
     *
     * @param index    The index of the operator's first character.
     * @param operator {@code =}, {@code <-} or {@code :=}.
     */
    public record OperatorMatch(int index, String operator) {
        /**
         * @return The index of the first character after the operator.
         */
        public int end() {
            return index + operator.length();
        }
    }

    /**
     * Finds the first assignment operator outside quotes.
     * {@code ==}, {@code <=}, {@code >=} and {@code !=} are comparisons, not assignments.
     *
     * @param text The text to scan.
     * @return The first operator, or empty if there is none.
     */
    public static Optional<OperatorMatch> findOperator(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (text.startsWith(":=", i)) {
                return Optional.of(new OperatorMatch(i, ":="));
            } else if (text.startsWith("<-", i)) {
                return Optional.of(new OperatorMatch(i, "<-"));
            } else if (c == '=') {
                char prev = i > 0 ? text.charAt(i - 1) : 0;
                char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
                if (next == '=') {
                    i++;
                } else if (prev != '<' && prev != '>' && prev != '!' && prev != '=') {
                    return Optional.of(new OperatorMatch(i, "="));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Removes a leading {@code SET} or {@code LET}.
     * @param target The left-hand side.
     * @return The target without the prefix.
     */
    public static String stripPrefix(String target) {
        return PREFIX.matcher(target.strip()).replaceFirst("").strip();
    }

    /**
     * @param target The stripped target.
     * @return true if the target is an identifier, optionally indexed or dotted.
     */
    public static boolean isValidTarget(String target) {
        return TARGET.matcher(target).matches();
    }

    /**
     * Returns the identifier a target starts with, so {@code scores[i]} binds {@code scores}.
     * @param target A valid target.
     * @return The base identifier.
     */
    public static String baseName(String target) {
        var matcher = BASE_NAME.matcher(target);
        return matcher.find() ? matcher.group() : target;
    }
}
