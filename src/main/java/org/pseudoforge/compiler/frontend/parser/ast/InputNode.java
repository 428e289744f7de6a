package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * Reads a value into a variable, e.g. {@code INPUT age}.
 *
 * @param sourceLine     The source line.
 * @param lineNumber     The line number.
 * @param targetVariable The variable receiving the value.
 */
public record InputNode(
        String sourceLine,
        int lineNumber,
        String targetVariable
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitInput(this);
    }
}
