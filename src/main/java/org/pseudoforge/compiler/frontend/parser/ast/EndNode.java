package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * An {@code END} or {@code STOP} marker.
 */
public record EndNode(
        String sourceLine,
        int lineNumber
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitEnd(this);
    }
}
