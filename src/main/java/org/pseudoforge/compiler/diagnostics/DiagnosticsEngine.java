package org.pseudoforge.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the {@link SyntaxDiagnostic}s reported while parsing.
 * <p>
 * This decouples issue reporting from the statement handlers: handlers report and carry on,
 * nothing is thrown. Diagnostics are kept in the order they were reported.
 */
public class DiagnosticsEngine {

    private final List<SyntaxDiagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an issue.
     *
     * @param kind       The category of the issue.
     * @param message    The issue description.
     * @param lineNumber The line the issue was found on.
     * @param suggestion A remediation hint for the user.
     */
    public void report(DiagnosticKind kind, String message, int lineNumber, String suggestion) {
        diagnostics.add(new SyntaxDiagnostic(lineNumber, message, kind, suggestion));
    }

    /**
     * Checks if any issue has been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Counts the diagnostics of one kind.
     *
     * @param kind The kind to count.
     * @return The number of diagnostics of that kind.
     */
    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return The diagnostics in encounter order.
     */
    public List<SyntaxDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One diagnostic per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(SyntaxDiagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
