package org.pseudoforge.compiler.backend.emit;

import org.pseudoforge.compiler.frontend.parser.ParseResult;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.EndNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StartNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementVisitor;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

import java.util.List;

/**
 * The base class for all emitters. It walks the statement tree and calls one hook per
 * statement variant; subclasses only decide what text each variant becomes.
 * <p>
 * All per-call state lives in an {@link EmissionContext}, so one emitter instance can serve
 * concurrent emissions.
 */
public abstract class AbstractCodeEmitter implements ICodeEmitter {

    protected final int indentWidth;

    protected AbstractCodeEmitter(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    @Override
    public final String emit(ParseResult program) {
        EmissionContext ctx = new EmissionContext(new CodeWriter(indentWidth), program);
        writePrologue(ctx);
        writeStatements(program.statements(), ctx);
        writeEpilogue(ctx);
        return ctx.writer().toString();
    }

    /**
     * Writes a sequence of statements at the current indentation.
     */
    protected final void writeStatements(List<StatementNode> statements, EmissionContext ctx) {
        StatementWriter writer = new StatementWriter(ctx);
        for (StatementNode statement : statements) {
            statement.accept(writer);
        }
    }

    /**
     * Writes a nested block one level deeper, in a new variable scope.
     */
    protected final void writeBlock(List<StatementNode> body, EmissionContext ctx) {
        ctx.writer().indent();
        ctx.pushScope();
        writeStatements(body, ctx);
        if (needsPlaceholder(body)) {
            writeEmptyBlockPlaceholder(ctx);
        }
        ctx.popScope();
        ctx.writer().dedent();
    }

    /**
     * Decides if a block needs a no-op statement. By default only an empty block does.
     */
    protected boolean needsPlaceholder(List<StatementNode> body) {
        return body.isEmpty();
    }

    /**
     * @return true if any statement of the block produces executable code.
     */
    protected static boolean hasExecutableStatement(List<StatementNode> body) {
        for (StatementNode node : body) {
            if (!(node instanceof CommentNode) && !(node instanceof StartNode) && !(node instanceof EndNode)) {
                return true;
            }
        }
        return false;
    }

    protected abstract void writePrologue(EmissionContext ctx);

    protected abstract void writeEpilogue(EmissionContext ctx);

    protected abstract void writeEmptyBlockPlaceholder(EmissionContext ctx);

    /** START and END are scaffolding and write nothing unless overridden. */
    protected void writeStart(StartNode node, EmissionContext ctx) {
    }

    protected void writeEnd(EndNode node, EmissionContext ctx) {
    }

    protected abstract void writeComment(CommentNode node, EmissionContext ctx);

    protected abstract void writeInput(InputNode node, EmissionContext ctx);

    protected abstract void writeOutput(OutputNode node, EmissionContext ctx);

    protected abstract void writeAssignment(AssignmentNode node, EmissionContext ctx);

    protected abstract void writeIf(IfNode node, EmissionContext ctx);

    protected abstract void writeWhile(WhileNode node, EmissionContext ctx);

    protected abstract void writeFor(ForNode node, EmissionContext ctx);

    private final class StatementWriter implements StatementVisitor<Void> {
        private final EmissionContext ctx;

        private StatementWriter(EmissionContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public Void visitStart(StartNode node) {
            writeStart(node, ctx);
            return null;
        }

        @Override
        public Void visitEnd(EndNode node) {
            writeEnd(node, ctx);
            return null;
        }

        @Override
        public Void visitComment(CommentNode node) {
            writeComment(node, ctx);
            return null;
        }

        @Override
        public Void visitInput(InputNode node) {
            writeInput(node, ctx);
            return null;
        }

        @Override
        public Void visitOutput(OutputNode node) {
            writeOutput(node, ctx);
            return null;
        }

        @Override
        public Void visitAssignment(AssignmentNode node) {
            writeAssignment(node, ctx);
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            writeIf(node, ctx);
            return null;
        }

        @Override
        public Void visitWhile(WhileNode node) {
            writeWhile(node, ctx);
            return null;
        }

        @Override
        public Void visitFor(ForNode node) {
            writeFor(node, ctx);
            return null;
        }
    }
}
