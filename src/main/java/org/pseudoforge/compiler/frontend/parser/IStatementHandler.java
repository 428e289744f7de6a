package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

/**
 * The base interface for all statement handlers.
 * Each handler parses one {@link StatementKind}, starting at the current line.
 */
public interface IStatementHandler {

    /**
     * Parses the statement at the current line and consumes every line that belongs to it.
     *
     * @param context The shared parsing state.
     * @return The parsed node, or {@code null} if the line was reported and dropped.
     */
    StatementNode parse(ParsingContext context);
}
