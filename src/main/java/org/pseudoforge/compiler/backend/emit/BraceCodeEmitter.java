package org.pseudoforge.compiler.backend.emit;

import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

/**
 * The base class for targets with brace-delimited blocks and {@code //} comments.
 * Subclasses supply the statement headers; the block layout is shared.
 */
public abstract class BraceCodeEmitter extends AbstractCodeEmitter {

    protected BraceCodeEmitter(int indentWidth) {
        super(indentWidth);
    }

    /**
     * @return true to put opening braces on their own line.
     */
    protected boolean bracesOnOwnLine() {
        return false;
    }

    /** The target's literal for false, used when a condition is missing. */
    protected String falseLiteral() {
        return "false";
    }

    protected abstract String ifHeader(String condition);

    protected abstract String whileHeader(String condition);

    /**
     * Builds the counting-loop header. The upper bound is inclusive; a negative literal step
     * counts down to an inclusive lower bound.
     */
    protected abstract String forHeader(ForNode node, EmissionContext ctx);

    /**
     * Opens a block: writes the header and the opening brace.
     */
    protected final void open(String header, EmissionContext ctx) {
        if (bracesOnOwnLine()) {
            ctx.writer().line(header);
            ctx.writer().line("{");
        } else {
            ctx.writer().line(header + " {");
        }
    }

    @Override
    protected void writeEmptyBlockPlaceholder(EmissionContext ctx) {
        ctx.writer().line("// no action");
    }

    @Override
    protected void writeComment(CommentNode node, EmissionContext ctx) {
        String text = Expressions.commentText(node.sourceLine());
        ctx.writer().line(text.isEmpty() ? "//" : "// " + text);
    }

    @Override
    protected void writeIf(IfNode node, EmissionContext ctx) {
        open(ifHeader(Expressions.conditionOr(node.conditionExpression(), falseLiteral())), ctx);
        writeBlock(node.thenBody(), ctx);
        if (node.elseBody().isEmpty()) {
            ctx.writer().line("}");
            return;
        }
        if (bracesOnOwnLine()) {
            ctx.writer().line("}");
            ctx.writer().line("else");
            ctx.writer().line("{");
        } else {
            ctx.writer().line("} else {");
        }
        writeBlock(node.elseBody(), ctx);
        ctx.writer().line("}");
    }

    @Override
    protected void writeWhile(WhileNode node, EmissionContext ctx) {
        open(whileHeader(Expressions.conditionOr(node.conditionExpression(), falseLiteral())), ctx);
        writeBlock(node.body(), ctx);
        ctx.writer().line("}");
    }

    @Override
    protected void writeFor(ForNode node, EmissionContext ctx) {
        open(forHeader(node, ctx), ctx);
        ctx.pushScope();
        ctx.declare(node.loopVariable());
        writeBlock(node.body(), ctx);
        ctx.popScope();
        ctx.writer().line("}");
    }

    /**
     * Builds the C-style three-part loop header shared by most brace targets, e.g.
     * {@code for (int i = 1; i <= 10; i++)}. A counter that is already declared in an enclosing
     * scope is reused, e.g. {@code for (i = 1; i <= 10; i++)}.
     *
     * @param declaration The counter declaration keyword, e.g. {@code int} or {@code let}.
     * @param parenthesized Whether the header is wrapped in parentheses.
     */
    protected static String countingLoop(ForNode node, String declaration, boolean parenthesized, EmissionContext ctx) {
        String v = node.loopVariable();
        boolean down = Expressions.isDescending(node.stepExpr());
        String magnitude = Expressions.stepMagnitude(node.stepExpr());
        String init;
        if (ctx.isDeclared(v)) {
            init = v + " = " + node.startExpr();
        } else if (declaration.isEmpty()) {
            init = v + " := " + node.startExpr();
        } else {
            init = declaration + " " + v + " = " + node.startExpr();
        }
        String test = v + (down ? " >= " : " <= ") + node.endExpr();
        String update;
        if ("1".equals(magnitude)) {
            update = v + (down ? "--" : "++");
        } else {
            update = v + (down ? " -= " : " += ") + magnitude;
        }
        String parts = init + "; " + test + "; " + update;
        return parenthesized ? "for (" + parts + ")" : "for " + parts;
    }
}
