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
 * Emits a Rust {@code main} function. Counting loops use inclusive ranges.
 */
public class RustEmitter extends BraceCodeEmitter {

    public RustEmitter(int indentWidth) {
        super(indentWidth);
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.RUST;
    }

    @Override
    protected void writePrologue(EmissionContext ctx) {
        ctx.writer().line("// Generated Rust code from pseudocode").blank();
        if (ctx.program().hasInput()) {
            ctx.writer().line("use std::io;").blank();
        }
        ctx.writer().line("fn main() {").indent();
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
        return "while " + condition;
    }

    @Override
    protected String forHeader(ForNode node, EmissionContext ctx) {
        String magnitude = Expressions.stepMagnitude(node.stepExpr());
        boolean unit = "1".equals(magnitude);
        String range;
        if (Expressions.isDescending(node.stepExpr())) {
            range = "(" + node.endExpr() + "..=" + node.startExpr() + ").rev()";
        } else {
            range = unit ? node.startExpr() + "..=" + node.endExpr() : "(" + node.startExpr() + "..=" + node.endExpr() + ")";
        }
        if (!unit) {
            boolean literal = Expressions.integerLiteral(magnitude).isPresent();
            range += ".step_by(" + (literal ? magnitude : magnitude + " as usize") + ")";
        }
        return "for " + node.loopVariable() + " in " + range;
    }

    @Override
    protected void writeInput(InputNode node, EmissionContext ctx) {
        String v = node.targetVariable();
        ctx.writer().line("println!(\"Enter " + v + ": \");");
        if (ctx.declare(v)) {
            ctx.writer().line("let mut " + v + " = String::new();");
        } else {
            ctx.writer().line(v + " = String::new();");
        }
        ctx.writer().line("io::stdin().read_line(&mut " + v + ").expect(\"Failed to read line\");");
        ctx.writer().line(v + " = " + v + ".trim().to_string();");
    }

    @Override
    protected void writeOutput(OutputNode node, EmissionContext ctx) {
        String message = node.message();
        if (Expressions.isQuotedLiteral(message)) {
            String literal = Expressions.toDoubleQuoted(message).replace("{", "{{").replace("}", "}}");
            ctx.writer().line("println!(" + literal + ");");
        } else {
            ctx.writer().line("println!(\"{}\", " + message + ");");
        }
    }

    @Override
    protected void writeAssignment(AssignmentNode node, EmissionContext ctx) {
        String target = node.targetVariable();
        boolean declare = Expressions.isPlainIdentifier(target) && ctx.declare(target);
        ctx.writer().line((declare ? "let mut " : "") + target + " = " + node.valueExpression() + ";");
    }
}
