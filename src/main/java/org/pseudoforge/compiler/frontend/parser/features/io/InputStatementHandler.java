package org.pseudoforge.compiler.frontend.parser.features.io;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.KeywordTable;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

import java.util.Arrays;

/**
 * Handles {@code INPUT x}, {@code READ x} and {@code GET x}.
 * Only the first variable is read; a list such as {@code INPUT a, b} is reported.
 */
public class InputStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Line line = context.advance();
        String remainder = KeywordTable.remainderAfterKeyword(line.content()).replaceFirst("^[\\s,;]+", "");
        if (remainder.isEmpty()) {
            context.getDiagnostics().report(DiagnosticKind.INCOMPLETE_STATEMENT,
                    "Input statement has no variable to read into",
                    line.lineNumber(),
                    "Name the variable to read, e.g. INPUT age");
            return null;
        }

        String[] tokens = remainder.split("[\\s,;]+");
        String variable = tokens[0];
        if (tokens.length > 1) {
            context.getDiagnostics().report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                    "Only '" + variable + "' is read; "
                            + String.join(", ", Arrays.asList(tokens).subList(1, tokens.length)) + " ignored",
                    line.lineNumber(),
                    "Use one INPUT line per variable");
        }
        context.getUsageTracker().recordInput(variable);
        return new InputNode(line.content(), line.lineNumber(), variable);
    }
}
