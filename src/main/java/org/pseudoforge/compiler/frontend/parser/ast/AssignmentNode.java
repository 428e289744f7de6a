package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * Binds a value to a variable, e.g. {@code SET total = total + x}.
 *
 * @param sourceLine      The source line.
 * @param lineNumber      The line number.
 * @param targetVariable  The variable, with any {@code SET} prefix removed.
 * @param valueExpression The expression on the right-hand side, as written.
 * @param operator        The assignment operator used: {@code =}, {@code <-} or {@code :=}.
 */
public record AssignmentNode(
        String sourceLine,
        int lineNumber,
        String targetVariable,
        String valueExpression,
        String operator
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitAssignment(this);
    }
}
