package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.frontend.parser.features.assign.AssignmentStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.conditional.IfStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.io.InputStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.io.OutputStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.loop.ForStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.loop.WhileStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.marker.CommentStatementHandler;
import org.pseudoforge.compiler.frontend.parser.features.marker.MarkerStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry mapping each {@link StatementKind} to its handler.
 */
public class StatementHandlerRegistry {
    private final Map<StatementKind, IStatementHandler> handlers = new EnumMap<>(StatementKind.class);

    /**
     * Registers a handler.
     * @param kind The statement kind.
     * @param handler The handler for that kind.
     */
    public void register(StatementKind kind, IStatementHandler handler) {
        handlers.put(kind, handler);
    }

    /**
     * Gets the handler for a statement kind.
     * @param kind The statement kind.
     * @return An {@link Optional} containing the handler if one is registered.
     */
    public Optional<IStatementHandler> get(StatementKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    /**
     * Initializes the registry with all built-in handlers.
     * @return A new registry with a handler for every statement kind.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(StatementKind.START, new MarkerStatementHandler(StatementKind.START));
        registry.register(StatementKind.END, new MarkerStatementHandler(StatementKind.END));
        registry.register(StatementKind.COMMENT, new CommentStatementHandler());
        registry.register(StatementKind.INPUT, new InputStatementHandler());
        registry.register(StatementKind.OUTPUT, new OutputStatementHandler());
        registry.register(StatementKind.IF, new IfStatementHandler());
        registry.register(StatementKind.WHILE, new WhileStatementHandler());
        registry.register(StatementKind.FOR, new ForStatementHandler());
        registry.register(StatementKind.ASSIGNMENT, new AssignmentStatementHandler());
        return registry;
    }
}
