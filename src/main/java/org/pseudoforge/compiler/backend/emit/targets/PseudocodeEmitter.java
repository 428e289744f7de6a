package org.pseudoforge.compiler.backend.emit.targets;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.backend.emit.AbstractCodeEmitter;
import org.pseudoforge.compiler.backend.emit.EmissionContext;
import org.pseudoforge.compiler.backend.emit.Expressions;
import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.GuidanceCatalog;
import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.EndNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StartNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-serializes the statement tree as canonical pseudocode.
 * <p>
 * Every construct is written in one fixed spelling, {@code START} and {@code END} are added
 * when the top level lacks them, and the detected issues are listed first as {@code //}
 * comments. The output contains no blank lines, so reformatting it again yields the same text.
 */
public class PseudocodeEmitter extends AbstractCodeEmitter {

    public PseudocodeEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.PSEUDOCODE;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        List<SyntaxDiagnostic> diagnostics = ctx.program().diagnostics();
        if (!diagnostics.isEmpty()) {
            ctx.writer().line("// Detected issues:");
            int n = 1;
            for (SyntaxDiagnostic d : diagnostics) {
                ctx.writer().line("// " + n++ + ". " + d);
                if (d.suggestion() != null && !d.suggestion().isBlank()) {
                    ctx.writer().line("// Suggestion: " + d.suggestion());
                }
            }
            ctx.writer().line("// Notes:");
            Set<DiagnosticKind> kinds = new LinkedHashSet<>();
            diagnostics.forEach(d -> kinds.add(d.kind()));
            for (DiagnosticKind kind : kinds) {
                ctx.writer().line("// - " + GuidanceCatalog.remediationNote(kind));
            }
        }
        if (ctx.program().statements().stream().noneMatch(StartNode.class::isInstance)) {
            ctx.writer().line("START");
        }
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
        List<StatementNode> top = ctx.program().statements();
        if (top.stream().noneMatch(EndNode.class::isInstance)) {
            ctx.writer().line("END");
        }
    }

    @Override
    protected void writeEmptyBlockPlaceholder(EmissionContext ctx) {
        // an empty block stays empty
    }

    @Override
    protected void writeStart(StartNode node, EmissionContext ctx) {
        ctx.writer().line("START");
    }

    @Override
    protected void writeEnd(EndNode node, EmissionContext ctx) {
        ctx.writer().line("END");
    }

    @Override
    protected void writeComment(CommentNode node, EmissionContext ctx) {
        String text = Expressions.commentText(node.sourceLine());
        ctx.writer().line(text.isEmpty() ? "//" : "// " + text);
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        ctx.writer().line("INPUT " + node.targetVariable());
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        ctx.writer().line("OUTPUT " + node.message());
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        ctx.writer().line("SET " + node.targetVariable() + " = " + node.valueExpression());
    }

    @Override
    protected void writeIf(IfNode node, EmissionContext ctx) {
        ctx.writer().line(joinNonEmpty("IF", node.conditionExpression(), "THEN"));
        writeBlock(node.thenBody(), ctx);
        if (!node.elseBody().isEmpty()) {
            ctx.writer().line("ELSE");
            writeBlock(node.elseBody(), ctx);
        }
        ctx.writer().line("END IF");
    }

    @Override
    protected void writeWhile(WhileNode node, EmissionContext ctx) {
        ctx.writer().line(joinNonEmpty("WHILE", node.conditionExpression()));
        writeBlock(node.body(), ctx);
        ctx.writer().line("END WHILE");
    }

    @Override
    protected void writeFor(ForNode node, EmissionContext ctx) {
        String header = "FOR " + node.loopVariable() + " = " + node.startExpr() + " TO " + node.endExpr();
        if (!"1".equals(node.stepExpr())) {
            header += " STEP " + node.stepExpr();
        }
        ctx.writer().line(header);
        writeBlock(node.body(), ctx);
        ctx.writer().line("END FOR");
    }

    private static String joinNonEmpty(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
