package org.pseudoforge.compiler.frontend.lexer;

/**
 * A single non-blank line of pseudocode.
 *
 * @param content    The line with surrounding whitespace removed.
 * @param lineNumber The 1-based line number in the original text.
 */
public record Line(
        String content,
        int lineNumber
) {
}
