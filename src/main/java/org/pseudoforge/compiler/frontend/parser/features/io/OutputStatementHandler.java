package org.pseudoforge.compiler.frontend.parser.features.io;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.KeywordTable;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

/**
 * Handles {@code OUTPUT}, {@code PRINT}, {@code DISPLAY} and {@code WRITE}.
 * The message is kept as written: a quoted literal or an expression.
 */
public class OutputStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Line line = context.advance();
        String message = KeywordTable.remainderAfterKeyword(line.content());
        if (message.isEmpty()) {
            context.getDiagnostics().report(DiagnosticKind.INCOMPLETE_STATEMENT,
                    "Output statement has nothing to show",
                    line.lineNumber(),
                    "Add a message or a variable, e.g. OUTPUT \"Hello\" or OUTPUT total");
            return null;
        }
        context.getUsageTracker().recordOutput();
        return new OutputNode(line.content(), line.lineNumber(), message);
    }
}
