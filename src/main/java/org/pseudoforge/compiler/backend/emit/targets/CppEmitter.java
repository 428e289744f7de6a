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
 * Emits a C++ program with {@code iostream}.
 */
public class CppEmitter extends BraceCodeEmitter {

    public CppEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.CPP;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated C++ code from pseudocode").blank()
                .line("#include <iostream>")
                .line("#include <string>")
                .line("using namespace std;").blank()
                .line("int main() {").indent();
    }

    @Override
    protected void writeEpilogue(EmissionContext ctx) {
        ctx.writer().line("return 0;").dedent().line("}");
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
        ctx.writer().line("cout << \"Enter " + v + ": \";");
        if (ctx.declare(v)) {
            ctx.writer().line("string " + v + ";");
        }
        ctx.writer().line("cin >> " + v + ";");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            message = Expressions.toDoubleQuoted(message);
        }
        ctx.writer().line("cout << " + message + " << endl;");
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line((declare ? "auto " : "") + target + " = " + node.valueExpression() + ";");
    }
}
