package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * A {@code START} or {@code BEGIN} marker.
 */
public record StartNode(
        String sourceLine,
        int lineNumber
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitStart(this);
    }
}
