package org.pseudoforge.compiler.backend.emit;

import org.pseudoforge.compiler.frontend.parser.ParseResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * The state of one emission: the output buffer and the chain of variable scopes.
 * A new context is created for every call to {@link ICodeEmitter#emit(ParseResult)}.
 */
public final class EmissionContext {

    private final CodeWriter writer;
    private final ParseResult program;
    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    public EmissionContext(CodeWriter writer, ParseResult program) {
        this.writer = writer;
        this.program = program;
        scopes.push(new HashSet<>());
    }

    public CodeWriter writer() {
        return writer;
    }

    public ParseResult program() {
        return program;
    }

    public void pushScope() {
        scopes.push(new HashSet<>());
    }

    public void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the program scope");
        }
        scopes.pop();
    }

    /**
     * Declares a variable in the innermost scope unless a visible scope already has it.
     * @param name The variable name.
     * @return true if this is the first binding visible from here.
     */
    public boolean declare(String name) {
        if (isDeclared(name)) {
            return false;
        }
        scopes.peek().add(name);
        return true;
    }

    /**
     * @param name The variable name.
     * @return true if any enclosing scope declares the variable.
     */
    public boolean isDeclared(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
