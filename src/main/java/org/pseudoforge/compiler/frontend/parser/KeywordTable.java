package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.frontend.parser.features.assign.AssignmentSyntax;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An ordered table of {@code (keyword, kind)} pairs used to classify pseudocode lines.
 * <p>
 * Entries are checked in order and the first match wins; a line that matches no entry but
 * contains an assignment operator is an assignment. Matching ignores case and collapses runs of
 * whitespace, so {@code end   if} and {@code END IF} are the same keyword.
 * Also holds the terminator keywords that close blocks.
 */
public final class KeywordTable {

    /** Closes the then-branch of an IF. */
    public static final List<String> IF_THEN_TERMINATORS = List.of("ELSE IF", "ELSEIF", "ELSE", "END IF", "ENDIF");
    /** Closes the else-branch of an IF. Further else-variants continue the flattened else-branch. */
    public static final List<String> IF_ELSE_TERMINATORS = List.of("ELSE IF", "ELSEIF", "ELSE", "END IF", "ENDIF");
    /** The keywords that open an else-branch. */
    public static final List<String> ELSE_VARIANTS = List.of("ELSE IF", "ELSEIF", "ELSE");
    /** The else-variants that carry a condition of their own. */
    public static final List<String> ELSE_IF_VARIANTS = List.of("ELSE IF", "ELSEIF");
    /** The keywords that end an IF block. */
    public static final List<String> END_IF = List.of("END IF", "ENDIF");
    /** Closes a WHILE block. */
    public static final List<String> WHILE_TERMINATORS = List.of("END WHILE", "ENDWHILE");
    /** Closes a FOR block. */
    public static final List<String> FOR_TERMINATORS = List.of("NEXT", "END FOR", "ENDFOR");

    private static final List<String> ALL_TERMINATORS;

    static {
        List<String> all = new ArrayList<>(IF_THEN_TERMINATORS);
        all.addAll(WHILE_TERMINATORS);
        all.addAll(FOR_TERMINATORS);
        ALL_TERMINATORS = List.copyOf(all);
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * How a keyword is compared with a line.
     */
    public enum MatchMode {
        /** The whole line must be the keyword, e.g. {@code START}. */
        WHOLE_LINE,
        /** The line is the keyword or starts with the keyword followed by whitespace. */
        WORD,
        /** The line starts with the marker, e.g. {@code //}. */
        MARKER
    }

    /**
     * One row of the table.
     *
     * @param keyword The upper-case keyword.
     * @param kind    The statement kind the keyword introduces.
     * @param mode    How the keyword is matched.
     */
    public record Entry(String keyword, StatementKind kind, MatchMode mode) {

        boolean matches(String normalizedLine) {
            return switch (mode) {
                case WHOLE_LINE -> normalizedLine.equals(keyword);
                case WORD -> matchesKeyword(normalizedLine, keyword);
                case MARKER -> normalizedLine.startsWith(keyword);
            };
        }
    }

    private final List<Entry> entries;

    /**
     * Constructs a table from explicit entries.
     * @param entries The entries in priority order.
     */
    public KeywordTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Creates the table for the supported pseudocode dialects.
     * @return The default table.
     */
    public static KeywordTable defaults() {
        return new KeywordTable(List.of(
                new Entry("START", StatementKind.START, MatchMode.WHOLE_LINE),
                new Entry("BEGIN", StatementKind.START, MatchMode.WHOLE_LINE),
                new Entry("END", StatementKind.END, MatchMode.WHOLE_LINE),
                new Entry("STOP", StatementKind.END, MatchMode.WHOLE_LINE),
                new Entry("//", StatementKind.COMMENT, MatchMode.MARKER),
                new Entry("#", StatementKind.COMMENT, MatchMode.MARKER),
                new Entry("/*", StatementKind.COMMENT, MatchMode.MARKER),
                new Entry("INPUT", StatementKind.INPUT, MatchMode.WORD),
                new Entry("READ", StatementKind.INPUT, MatchMode.WORD),
                new Entry("GET", StatementKind.INPUT, MatchMode.WORD),
                new Entry("OUTPUT", StatementKind.OUTPUT, MatchMode.WORD),
                new Entry("PRINT", StatementKind.OUTPUT, MatchMode.WORD),
                new Entry("DISPLAY", StatementKind.OUTPUT, MatchMode.WORD),
                new Entry("WRITE", StatementKind.OUTPUT, MatchMode.WORD),
                new Entry("IF", StatementKind.IF, MatchMode.WORD),
                new Entry("WHILE", StatementKind.WHILE, MatchMode.WORD),
                new Entry("FOR", StatementKind.FOR, MatchMode.WORD)
        ));
    }

    /**
     * Returns a copy of this table with one more entry, checked after all existing ones.
     * @param entry The entry to add.
     * @return The extended table.
     */
    public KeywordTable with(Entry entry) {
        List<Entry> extended = new ArrayList<>(entries);
        extended.add(entry);
        return new KeywordTable(extended);
    }

    /**
     * @return The entries in priority order.
     */
    public List<Entry> entries() {
        return entries;
    }

    /**
     * Classifies a line.
     *
     * @param content The trimmed line.
     * @return The statement kind, or empty if the line is not a known statement.
     */
    public Optional<StatementKind> classify(String content) {
        String normalized = normalize(content);
        for (Entry entry : entries) {
            if (entry.matches(normalized)) {
                return Optional.of(entry.kind());
            }
        }
        if (AssignmentSyntax.findOperator(content).isPresent()) {
            return Optional.of(StatementKind.ASSIGNMENT);
        }
        return Optional.empty();
    }

    /**
     * Upper-cases a line and collapses whitespace, for keyword comparison only.
     * @param content The line.
     * @return The normalized line.
     */
    public static String normalize(String content) {
        return WHITESPACE.matcher(content.strip()).replaceAll(" ").toUpperCase(Locale.ROOT);
    }

    /**
     * Checks if a normalized line is the keyword or starts with the keyword and a space.
     * @param normalizedLine The normalized line.
     * @param keyword The upper-case keyword.
     * @return {@code true} on a match.
     */
    public static boolean matchesKeyword(String normalizedLine, String keyword) {
        return normalizedLine.equals(keyword) || normalizedLine.startsWith(keyword + " ");
    }

    /**
     * Checks a normalized line against several keywords.
     * @param normalizedLine The normalized line.
     * @param keywords The upper-case keywords.
     * @return {@code true} if any keyword matches.
     */
    public static boolean matchesAny(String normalizedLine, Collection<String> keywords) {
        for (String keyword : keywords) {
            if (matchesKeyword(normalizedLine, keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the first of several keywords that a normalized line starts with.
     * @param normalizedLine The normalized line.
     * @param keywords The upper-case keywords, longer forms first.
     * @return The matching keyword, if any.
     */
    public static Optional<String> matchingKeyword(String normalizedLine, Collection<String> keywords) {
        for (String keyword : keywords) {
            if (matchesKeyword(normalizedLine, keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the text of a line that follows a keyword of one or more words, in its original case.
     * @param content The line.
     * @param keyword The upper-case keyword the line starts with.
     * @return The remainder, or an empty string if the line is just the keyword.
     */
    public static String textAfterKeyword(String content, String keyword) {
        int words = WHITESPACE.split(keyword).length;
        String[] parts = WHITESPACE.split(content.strip(), words + 1);
        return parts.length > words ? parts[words].strip() : "";
    }

    /**
     * @param normalizedLine The normalized line.
     * @return {@code true} if the line is any block terminator.
     */
    public static boolean isTerminator(String normalizedLine) {
        return matchesAny(normalizedLine, ALL_TERMINATORS);
    }

    /**
     * Returns everything after the first whitespace of a line, stripped.
     * @param content The line.
     * @return The remainder, or an empty string if the line is a single word.
     */
    public static String remainderAfterKeyword(String content) {
        String stripped = content.strip();
        for (int i = 0; i < stripped.length(); i++) {
            if (Character.isWhitespace(stripped.charAt(i))) {
                return stripped.substring(i + 1).strip();
            }
        }
        return "";
    }
}
