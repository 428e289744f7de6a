package org.pseudoforge.compiler.diagnostics;

/**
 * A single recoverable issue found while parsing pseudocode.
 *
 * @param lineNumber The 1-based line number in the original text.
 * @param message    What is wrong with the line.
 * @param kind       The category of the issue.
 * @param suggestion How the user can fix it.
 */
public record SyntaxDiagnostic(
        int lineNumber,
        String message,
        DiagnosticKind kind,
        String suggestion
) {
    @Override
    public String toString() {
        return String.format("[%s] line %d: %s", kind.displayName(), lineNumber, message);
    }
}
