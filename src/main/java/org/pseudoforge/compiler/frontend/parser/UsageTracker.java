package org.pseudoforge.compiler.frontend.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulates the variables a program binds and whether it reads input or writes output.
 * Variables keep the order in which they were first seen.
 */
public class UsageTracker {

    private final Set<String> variables = new LinkedHashSet<>();
    private boolean hasInput;
    private boolean hasOutput;

    /**
     * Records a variable that is bound by an assignment or used as a loop counter.
     * @param name The variable name.
     */
    public void recordVariable(String name) {
        variables.add(name);
    }

    /**
     * Records an input statement reading into a variable.
     * @param name The variable name.
     */
    public void recordInput(String name) {
        hasInput = true;
        variables.add(name);
    }

    /**
     * Records an output statement.
     */
    public void recordOutput() {
        hasOutput = true;
    }

    public Set<String> getVariables() {
        return Collections.unmodifiableSet(variables);
    }

    public boolean hasInput() {
        return hasInput;
    }

    public boolean hasOutput() {
        return hasOutput;
    }
}
