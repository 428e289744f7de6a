package org.pseudoforge.compiler.frontend.parser.features.loop;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.KeywordTable;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Handles {@code WHILE c [DO] ... END WHILE}.
 */
public class WhileStatementHandler implements IStatementHandler {

    private static final Pattern TRAILING_DO = Pattern.compile("(?i)(?:^|\\s+)DO$");

    @Override
    public StatementNode parse(ParsingContext context) {
        Line whileLine = context.advance();
        String condition = TRAILING_DO.matcher(KeywordTable.remainderAfterKeyword(whileLine.content()))
                .replaceFirst("")
                .strip();
        if (condition.isEmpty()) {
            context.getDiagnostics().report(DiagnosticKind.INCOMPLETE_STATEMENT,
                    "WHILE statement has no condition",
                    whileLine.lineNumber(),
                    "Add the condition that keeps the loop running, e.g. WHILE count < 10");
        }

        List<StatementNode> body = context.parseBlock(KeywordTable.WHILE_TERMINATORS);
        context.consumeTerminator(KeywordTable.WHILE_TERMINATORS, whileLine, "END WHILE");
        return new WhileNode(whileLine.content(), whileLine.lineNumber(), condition, body);
    }
}
