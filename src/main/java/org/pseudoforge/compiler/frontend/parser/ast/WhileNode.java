package org.pseudoforge.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A condition-checked loop.
 *
 * @param sourceLine          The WHILE line.
 * @param lineNumber          The line number of the WHILE line.
 * @param conditionExpression The loop condition, as written.
 * @param body                The loop body.
 */
public record WhileNode(
        String sourceLine,
        int lineNumber,
        String conditionExpression,
        List<StatementNode> body
) implements StatementNode {
    public WhileNode {
        body = List.copyOf(body);
    }

    @Override
    public List<StatementNode> getChildren() {
        return body;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitWhile(this);
    }
}
