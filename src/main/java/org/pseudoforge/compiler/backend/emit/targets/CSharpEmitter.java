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
 * Emits a C# console program. Braces go on their own line.
 */
public class CSharpEmitter extends BraceCodeEmitter {

    public CSharpEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.CSHARP;
    }

    @Override
    protected boolean bracesOnOwnLine() {
        return true;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated C# code from pseudocode").blank()
                .line("using System;").blank()
                .line("class Program")
                .line("{").indent()
                .line("static void Main()")
                .line("{").indent();
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
        ctx.writer().dedent().line("}").dedent().line("}");
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
        return countingLoop(node, "int", true, ctx);
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        String v = node.targetVariable();
        ctx.writer().line("Console.Write(\"Enter " + v + ": \");");
        ctx.writer().line((ctx.declare(v) ? "string " : "") + v + " = Console.ReadLine();");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("Console.WriteLine(" + message + ");");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line((declare ? "var " : "") + target + " = " + node.valueExpression() + ";");
    }
}
