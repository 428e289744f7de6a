package org.pseudoforge.compiler.frontend.parser.features.marker;

import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.StatementKind;
import org.pseudoforge.compiler.frontend.parser.ast.EndNode;
import org.pseudoforge.compiler.frontend.parser.ast.StartNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

/**
 * Handles the program markers {@code START}/{@code BEGIN} and {@code END}/{@code STOP}.
 */
public class MarkerStatementHandler implements IStatementHandler {

    private final StatementKind kind;

    /**
     * @param kind Either {@link StatementKind#START} or {@link StatementKind#END}.
     */
    public MarkerStatementHandler(StatementKind kind) {
        if (kind != StatementKind.START && kind != StatementKind.END) {
            throw new IllegalArgumentException("Not a marker kind: " + kind);
        }
        this.kind = kind;
    }

    @Override
    public StatementNode parse(ParsingContext context) {
        Line line = context.advance();
        if (kind == StatementKind.START) {
            return new StartNode(line.content(), line.lineNumber());
        }
        return new EndNode(line.content(), line.lineNumber());
    }
}
