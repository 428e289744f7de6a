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
 * Emits JavaScript for Node.js. Input is read synchronously from standard input through a
 * small {@code readLine} helper, written only when the program reads input.
 */
public class JavaScriptEmitter extends BraceCodeEmitter {

    public JavaScriptEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.JAVASCRIPT;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated JavaScript code from pseudocode").blank();
        if (ctx.program().hasInput()) {
            ctx.writer()
                    .line("const fs = require('fs');")
                    .blank()
                    .line("function readLine(promptText) {").indent()
                    .line("process.stdout.write(promptText);")
                    .line("const buffer = Buffer.alloc(1);")
                    .line("let line = '';")
                    .line("while (fs.readSync(0, buffer, 0, 1, null) === 1) {").indent()
                    .line("const ch = buffer.toString('utf8');")
                    .line("if (ch === '\\n') break;")
                    .line("line += ch;").dedent()
                    .line("}")
                    .line("return line.replace(/\\r$/, '');").dedent()
                    .line("}")
                    .blank();
        }
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
    }

    @Override
    protected String ifHeader(String condition) {
        return "if (" + condition + ")";
    }

    @Override
    protected String whileHeader(String condition) {
        return "while (" + condition + ")";
    }

    @Override
    protected String forHeader(ForNode node, EmissionContext ctx) {
        return countingLoop(node, "let", true, ctx);
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        String v = node.targetVariable();
        String read = "readLine(\"Enter " + v + ": \");";
        ctx.writer().line((ctx.declare(v) ? "let " : "") + v + " = " + read);
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("console.log(" + message + ");");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line((declare ? "let " : "") + target + " = " + node.valueExpression() + ";");
    }
}
