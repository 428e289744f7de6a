package org.pseudoforge.compiler.frontend.parser.features.loop;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.KeywordTable;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles {@code FOR i = a TO b [STEP s] [DO] ... NEXT}. {@code FROM} may replace {@code =},
 * and {@code END FOR} or {@code ENDFOR} may replace {@code NEXT}. The terminator may repeat the
 * loop variable, as in {@code NEXT i}. The upper bound is inclusive.
 */
public class ForStatementHandler implements IStatementHandler {

    private static final Pattern FOR = Pattern.compile(
            "(?i)^FOR\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(?:=|\\bFROM\\b)\\s*(.+?)\\s+TO\\s+(.+?)"
                    + "(?:\\s+STEP\\s+(.+?))?(?:\\s+DO)?\\s*$");

    @Override
    public StatementNode parse(ParsingContext context) {
        Line forLine = context.advance();
        Matcher m = FOR.matcher(forLine.content());
        if (!m.matches()) {
            context.getDiagnostics().report(DiagnosticKind.INVALID_SYNTAX,
                    "FOR statement is not in the form FOR i = start TO end [STEP s]",
                    forLine.lineNumber(),
                    "Write the loop as FOR i = 1 TO 10, optionally followed by STEP 2");
            return null;
        }
        String variable = m.group(1);
        String step = m.group(4) == null ? "1" : m.group(4).strip();
        context.getUsageTracker().recordVariable(variable);

        List<StatementNode> body = context.parseBlock(KeywordTable.FOR_TERMINATORS);
        context.consumeTerminator(KeywordTable.FOR_TERMINATORS, forLine, "NEXT", variable);
        return new ForNode(forLine.content(), forLine.lineNumber(), variable,
                m.group(2).strip(), m.group(3).strip(), step, body);
    }
}
