package org.pseudoforge.compiler.frontend.parser.ast;

/**
 * A visitor over the statement tree.
 *
 * @param <T> The return type of the visit methods.
 */
public interface StatementVisitor<T> {
    T visitStart(StartNode node);
    T visitEnd(EndNode node);
    T visitComment(CommentNode node);
    T visitInput(InputNode node);
    T visitOutput(OutputNode node);
    T visitAssignment(AssignmentNode node);
    T visitIf(IfNode node);
    T visitWhile(WhileNode node);
    T visitFor(ForNode node);
}
