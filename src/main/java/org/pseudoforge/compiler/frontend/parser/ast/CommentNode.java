package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * A comment line, kept verbatim including its marker.
 */
public record CommentNode(
        String sourceLine,
        int lineNumber
) implements StatementNode {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitComment(this);
    }
}
