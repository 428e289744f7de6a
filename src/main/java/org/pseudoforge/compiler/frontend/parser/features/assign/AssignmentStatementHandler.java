package org.pseudoforge.compiler.frontend.parser.features.assign;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.DiagnosticsEngine;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.features.assign.AssignmentSyntax.OperatorMatch;

/**
 * Handles assignments written with {@code =}, {@code <-} or {@code :=}, optionally prefixed
 * with {@code SET} or {@code LET}.
 */
public class AssignmentStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Line line = context.advance();
        DiagnosticsEngine diagnostics = context.getDiagnostics();
        String content = line.content();

        OperatorMatch op = AssignmentSyntax.findOperator(content).orElse(null);
        if (op == null) {
            diagnostics.report(DiagnosticKind.INVALID_SYNTAX,
                    "No assignment operator outside quotes in '" + content + "'",
                    line.lineNumber(),
                    "Write the assignment as name = value");
            return null;
        }

        String target = AssignmentSyntax.stripPrefix(content.substring(0, op.index()));
        String value = content.substring(op.end()).strip();
        if (target.isEmpty() || value.isEmpty()) {
            diagnostics.report(DiagnosticKind.INCOMPLETE_STATEMENT,
                    target.isEmpty() ? "Assignment has no variable to assign to" : "Assignment to '" + target + "' has no value",
                    line.lineNumber(),
                    "Fill in both sides, e.g. total = 0");
            return null;
        }
        if (AssignmentSyntax.findOperator(value).isPresent()) {
            diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                    "Chained assignment '" + content + "' is not supported",
                    line.lineNumber(),
                    "Use one assignment per line, and == to compare values");
            return null;
        }
        if (!AssignmentSyntax.isValidTarget(target)) {
            diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                    "'" + target + "' is not a variable name",
                    line.lineNumber(),
                    "Assign to a simple name made of letters, digits and underscores, e.g. total_score");
            return null;
        }

        context.getUsageTracker().recordVariable(AssignmentSyntax.baseName(target));
        return new AssignmentNode(content, line.lineNumber(), target, value, op.operator());
    }
}
