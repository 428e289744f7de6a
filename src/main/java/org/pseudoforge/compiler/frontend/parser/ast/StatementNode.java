package org.pseudoforge.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the statement tree.
 * <p>
 * The set of variants is closed; every consumer handles all of them through a
 * {@link StatementVisitor}, so adding a variant is a compile error in every emitter.
 */
public sealed interface StatementNode
        permits StartNode, EndNode, CommentNode, InputNode, OutputNode, AssignmentNode, IfNode, WhileNode, ForNode {

    /**
     * @return The trimmed source line this node was parsed from.
     */
    String sourceLine();

    /**
     * @return The 1-based line number of {@link #sourceLine()}.
     */
    int lineNumber();

    /**
     * Dispatches to the visit method for this variant.
     *
     * @param visitor The visitor.
     * @param <T>     The visitor's result type.
     * @return The visitor's result.
     */
    <T> T accept(StatementVisitor<T> visitor);

    /**
     * Returns the direct child statements, in order. For an IF these are the then-body
     * followed by the else-body.
     *
     * @return The child statements, or an empty list.
     */
    default List<StatementNode> getChildren() {
        return Collections.emptyList();
    }
}
