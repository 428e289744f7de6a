package org.pseudoforge.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A counting loop whose upper bound is inclusive, e.g. {@code FOR i = 1 TO 10 STEP 2}.
 *
 * @param sourceLine   The FOR line.
 * @param lineNumber   The line number of the FOR line.
 * @param loopVariable The counter variable.
 * @param startExpr    The first value of the counter.
 * @param endExpr      The last value the counter may take.
 * @param stepExpr     The increment, {@code "1"} unless a STEP was given.
 * @param body         The loop body.
 */
public record ForNode(
        String sourceLine,
        int lineNumber,
        String loopVariable,
        String startExpr,
        String endExpr,
        String stepExpr,
        List<StatementNode> body
) implements StatementNode {
    public ForNode {
        body = List.copyOf(body);
    }

    @Override
    public List<StatementNode> getChildren() {
        return body;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitFor(this);
    }
}
