package org.pseudoforge.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional with an optional else branch.
 *
 * @param sourceLine          The IF line.
 * @param lineNumber          The line number of the IF line.
 * @param conditionExpression The condition, as written.
 * @param thenBody            The statements run when the condition holds.
 * @param elseBody            The statements run otherwise, empty if there is no ELSE.
 */
public record IfNode(
        String sourceLine,
        int lineNumber,
        String conditionExpression,
        List<StatementNode> thenBody,
        List<StatementNode> elseBody
) implements StatementNode {
    public IfNode {
        thenBody = List.copyOf(thenBody);
        elseBody = List.copyOf(elseBody);
    }

    @Override
    public List<StatementNode> getChildren() {
        List<StatementNode> children = new ArrayList<>(thenBody);
        children.addAll(elseBody);
        return children;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitIf(this);
    }
}
