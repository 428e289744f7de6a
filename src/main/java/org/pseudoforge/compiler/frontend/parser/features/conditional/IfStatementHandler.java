package org.pseudoforge.compiler.frontend.parser.features.conditional;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.DiagnosticsEngine;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.KeywordTable;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles {@code IF c THEN ... [ELSE ...] END IF}.
 * <p>
 * {@code ELSE IF} chains are flattened into a single else-branch: the statements of every later
 * branch are appended to it and their conditions are not tested. Each flattened branch is
 * reported as {@link DiagnosticKind#AMBIGUOUS_STRUCTURE}.
 */
public class IfStatementHandler implements IStatementHandler {

    private static final Pattern THEN = Pattern.compile("(?i)(?:^|\\s)THEN(?=\\s|$)");

    @Override
    public StatementNode parse(ParsingContext context) {
        Line ifLine = context.advance();
        DiagnosticsEngine diagnostics = context.getDiagnostics();
        String afterIf = KeywordTable.remainderAfterKeyword(ifLine.content());

        String condition;
        Matcher then = THEN.matcher(afterIf);
        if (then.find()) {
            condition = afterIf.substring(0, then.start()).strip();
            String trailing = afterIf.substring(then.end()).strip();
            if (!trailing.isEmpty()) {
                diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                        "'" + trailing + "' after THEN is ignored",
                        ifLine.lineNumber(),
                        "Put the statements of the IF on their own lines and close the block with END IF");
            }
        } else {
            condition = afterIf;
            diagnostics.report(DiagnosticKind.MISSING_KEYWORD,
                    "IF statement is missing THEN",
                    ifLine.lineNumber(),
                    "Write THEN after the condition, e.g. IF x > 0 THEN");
        }
        if (condition.isEmpty()) {
            diagnostics.report(DiagnosticKind.INCOMPLETE_STATEMENT,
                    "IF statement has no condition",
                    ifLine.lineNumber(),
                    "Add the condition to test, e.g. IF x > 0 THEN");
        }

        List<StatementNode> thenBody = context.parseBlock(KeywordTable.IF_THEN_TERMINATORS);
        List<StatementNode> elseBody = new ArrayList<>();
        boolean sawElse = false;
        while (context.check(KeywordTable.ELSE_VARIANTS)) {
            Line elseLine = context.advance();
            String normalized = KeywordTable.normalize(elseLine.content());
            if (KeywordTable.matchesAny(normalized, KeywordTable.ELSE_IF_VARIANTS)) {
                diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                        "ELSE IF is treated as ELSE; the condition '" + elseIfCondition(elseLine.content()) + "' is not checked",
                        elseLine.lineNumber(),
                        "Nest a separate IF ... END IF inside the ELSE branch");
            } else if (sawElse) {
                context.reportTrailingText(elseLine, KeywordTable.ELSE_VARIANTS, null);
                diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                        "Additional ELSE is merged into the previous ELSE branch",
                        elseLine.lineNumber(),
                        "Use a single ELSE per IF");
            } else {
                context.reportTrailingText(elseLine, KeywordTable.ELSE_VARIANTS, null);
                sawElse = true;
            }
            elseBody.addAll(context.parseBlock(KeywordTable.IF_ELSE_TERMINATORS));
        }
        context.consumeTerminator(KeywordTable.END_IF, ifLine, "END IF");

        return new IfNode(ifLine.content(), ifLine.lineNumber(), condition, thenBody, elseBody);
    }

    private static String elseIfCondition(String content) {
        String rest = content.strip().replaceFirst("(?i)^ELSE\\s*IF", "").strip();
        Matcher then = THEN.matcher(rest);
        return then.find() ? rest.substring(0, then.start()).strip() : rest;
    }
}
