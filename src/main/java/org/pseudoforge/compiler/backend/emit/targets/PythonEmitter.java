package org.pseudoforge.compiler.backend.emit.targets;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.backend.emit.AbstractCodeEmitter;
import org.pseudoforge.compiler.backend.emit.EmissionContext;
import org.pseudoforge.compiler.backend.emit.Expressions;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

import java.util.List;

/**
 * Emits Python 3. Blocks are delimited by indentation, so a block without executable
 * statements gets {@code pass}.
 */
public class PythonEmitter extends AbstractCodeEmitter {

    public PythonEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.PYTHON;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("# Generated Python code from pseudocode").blank();
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
    }

    @Override
    protected boolean needsPlaceholder(List<StatementNode> body) {
        return !hasExecutableStatement(body);
    }

    @Override
    protected void writeEmptyBlockPlaceholder(EmissionContext ctx) {
        ctx.writer().line("pass");
    }

    @Override
    protected void writeComment(CommentNode node, EmissionContext ctx) {
        String text = Expressions.commentText(node.sourceLine());
        ctx.writer().line(text.isEmpty() ? "#" : "# " + text);
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        String v = node.targetVariable();
        ctx.writer().line(v + " = input(\"Enter " + v + ": \")");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("print(" + message + ")");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        ctx.writer().line(node.targetVariable() + " = " + node.valueExpression());
    }

    @Override
    protected void writeIf(IfNode node, EmissionContext ctx) {
        ctx.writer().line("if " + Expressions.conditionOr(node.conditionExpression(), "False") + ":");
        writeBlock(node.thenBody(), ctx);
        if (!node.elseBody().isEmpty()) {
            ctx.writer().line("else:");
            writeBlock(node.elseBody(), ctx);
        }
    }

    @Override
    protected void writeWhile(WhileNode node, EmissionContext ctx) {
        ctx.writer().line("while " + Expressions.conditionOr(node.conditionExpression(), "False") + ":");
        writeBlock(node.body(), ctx);
    }

    @Override
    protected void writeFor(ForNode node, EmissionContext ctx) {
        boolean down = Expressions.isDescending(node.stepExpr());
        String stop = Expressions.plus(node.endExpr(), down ? -1 : 1);
        String range = "1".equals(node.stepExpr())
                ? node.startExpr() + ", " + stop
                : node.startExpr() + ", " + stop + ", " + node.stepExpr();
        ctx.writer().line("for " + node.loopVariable() + " in range(" + range + "):");
        writeBlock(node.body(), ctx);
    }
}
