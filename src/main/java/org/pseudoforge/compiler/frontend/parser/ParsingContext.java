package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.DiagnosticsEngine;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

import java.util.List;
import java.util.Locale;

/**
 * The state shared by all statement handlers during one parse.
 * <p>
 * There is exactly one cursor per parse. A handler that opens a block calls
 * {@link #parseBlock(List)} and then consumes the terminator itself, so the enclosing
 * handler sees the cursor after the whole block.
 */
public interface ParsingContext {

    /**
     * Returns the current line without consuming it.
     * @return The current line.
     */
    Line peek();

    /**
     * Consumes the current line and returns it.
     * @return The consumed line.
     */
    Line advance();

    /**
     * Checks if all lines have been consumed.
     * @return true if at the end of the input, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Checks if the current line starts with any of the given keywords.
     * @param keywords Upper-case keywords.
     * @return true if the current line matches, false otherwise or at the end of the input.
     */
    boolean check(List<String> keywords);

    /**
     * Parses statements until the current line is one of the terminators, a terminator of an
     * enclosing block, or the end of the input. The terminator is not consumed.
     *
     * @param terminators The upper-case keywords that close this block.
     * @return The statements of the block.
     */
    List<StatementNode> parseBlock(List<String> terminators);

    /**
     * Gets the diagnostics engine for reporting issues.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Gets the tracker for variables and input/output usage.
     * @return The usage tracker.
     */
    UsageTracker getUsageTracker();

    /**
     * Consumes the terminator of a block, or reports it as missing.
     * A missing terminator is reported at the line that opened the block.
     *
     * @param terminators The keywords that close the block.
     * @param opener      The line that opened the block.
     * @param closing     The terminator to suggest, e.g. {@code END WHILE}.
     * @return true if a terminator was consumed.
     */
    default boolean consumeTerminator(List<String> terminators, Line opener, String closing) {
        return consumeTerminator(terminators, opener, closing, null);
    }

    /**
     * Consumes the terminator of a block, or reports it as missing. Text after the terminator
     * is reported as {@link DiagnosticKind#AMBIGUOUS_STRUCTURE} unless it equals
     * {@code permittedSuffix}, ignoring case, as in {@code NEXT i}.
     *
     * @param terminators     The keywords that close the block.
     * @param opener          The line that opened the block.
     * @param closing         The terminator to suggest, e.g. {@code END WHILE}.
     * @param permittedSuffix Text allowed after the terminator, or {@code null}.
     * @return true if a terminator was consumed.
     */
    default boolean consumeTerminator(List<String> terminators, Line opener, String closing, String permittedSuffix) {
        if (check(terminators)) {
            Line terminator = advance();
            reportTrailingText(terminator, terminators, permittedSuffix);
            return true;
        }
        String blockName = opener.content().split("\\s+")[0].toUpperCase(Locale.ROOT);
        String where = isAtEnd()
                ? "before the end of the program"
                : "before '" + peek().content() + "' on line " + peek().lineNumber();
        getDiagnostics().report(DiagnosticKind.MISSING_KEYWORD,
                blockName + " block starting on line " + opener.lineNumber() + " is not closed with " + closing + " " + where,
                opener.lineNumber(),
                "Add " + closing + " after the last statement of the block");
        return false;
    }

    /**
     * Reports text that follows a block keyword on the same line. Such text is not parsed.
     *
     * @param line            The consumed keyword line.
     * @param keywords        The keywords the line may start with.
     * @param permittedSuffix Text allowed after the keyword, or {@code null}.
     */
    default void reportTrailingText(Line line, List<String> keywords, String permittedSuffix) {
        KeywordTable.matchingKeyword(KeywordTable.normalize(line.content()), keywords).ifPresent(keyword -> {
            String trailing = KeywordTable.textAfterKeyword(line.content(), keyword);
            if (trailing.isEmpty() || trailing.equalsIgnoreCase(permittedSuffix)) {
                return;
            }
            getDiagnostics().report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                    "'" + trailing + "' after " + keyword + " is ignored",
                    line.lineNumber(),
                    "Put '" + trailing + "' on its own line");
        });
    }
}
