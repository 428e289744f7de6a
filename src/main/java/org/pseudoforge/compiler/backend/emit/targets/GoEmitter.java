package org.pseudoforge.compiler.backend.emit.targets;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.backend.emit.BraceCodeEmitter;
import org.pseudoforge.compiler.backend.emit.EmissionContext;
import org.pseudoforge.compiler.backend.emit.Expressions;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;

/**
 * Emits a Go {@code main} package. Go has no {@code while}; a condition-only {@code for} is used.
 */
public class GoEmitter extends BraceCodeEmitter {

    public GoEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.GO;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated Go code from pseudocode").blank()
                .line("package main").blank();
        if (ctx.program().hasInput()) {
            ctx.writer().line("import (").indent()
                    .line("\"bufio\"")
                    .line("\"fmt\"")
                    .line("\"os\"")
                    .line("\"strings\"").dedent()
                    .line(")");
        } else {
            ctx.writer().line("import \"fmt\"");
        }
        ctx.writer().blank().line("func main() {").indent();
        if (ctx.program().hasInput()) {
            ctx.writer().line("reader := bufio.NewReader(os.Stdin)");
        }
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
        ctx.writer().dedent().line("}");
    }

    @Override
    protected String ifHeader(String condition) {
        return "if " + condition;
    }

    @Override
    protected String whileHeader(String condition) {
        return "for " + condition;
    }

    @Override
    protected String forHeader(ForNode node, EmissionContext ctx) {
        return countingLoop(node, "", false, ctx);
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        String v = node.targetVariable();
        ctx.writer().line("fmt.Print(\"Enter " + v + ": \")");
        ctx.writer().line(v + ", _ " + (ctx.declare(v) ? ":=" : "=") + " reader.ReadString('\\n')");
        ctx.writer().line(v + " = strings.TrimSpace(" + v + ")");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("fmt.Println(" + message + ")");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line(target + (declare ? " := " : " = ") + node.valueExpression());
    }
}
