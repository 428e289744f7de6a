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
 * Emits a Java class with a {@code main} method. Input goes through a {@code Scanner}.
 */
public class JavaEmitter extends BraceCodeEmitter {

    public JavaEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.JAVA;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated Java code from pseudocode").blank();
        if (ctx.program().hasInput()) {
            ctx.writer().line("import java.util.Scanner;").blank();
        }
        ctx.writer().line("public class Main {").indent()
                .line("public static void main(String[] args) {").indent();
        if (ctx.program().hasInput()) {
            ctx.writer().line("Scanner scanner = new Scanner(System.in);");
        }
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
        ctx.writer().line("System.out.print(\"Enter " + v + ": \");");
        ctx.writer().line((ctx.declare(v) ? "String " : "") + v + " = scanner.nextLine();");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("System.out.println(" + message + ");");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line((declare ? "var " : "") + target + " = " + node.valueExpression() + ";");
    }
}
