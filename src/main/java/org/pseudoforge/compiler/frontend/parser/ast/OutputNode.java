package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * Shows a message or value, e.g. {@code PRINT "Hello"}.
 *
 * @param sourceLine The source line.
 * @param lineNumber The line number.
 * @param message    Everything after the keyword, as written.
 */
public record OutputNode(
        String sourceLine,
        int lineNumber,
        String message
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitOutput(this);
    }
}
