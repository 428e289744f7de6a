package org.pseudoforge.compiler.diagnostics;

import org.pseudoforge.compiler.api.ConversionErrorCode;
import org.pseudoforge.compiler.diagnostics.FailureGuidance.Severity;

import java.util.List;

/**
 * The user-facing wording for failures and diagnostics.
 * Messages are written for people learning to program, not as technical traces.
 */
public final class GuidanceCatalog {

    private GuidanceCatalog() {
        // Utility class
    }

    /**
     * Builds the guidance for a failed target.
     *
     * @param code        The failure code.
     * @param targetLabel The target as the user named it.
     * @return The guidance for that failure.
     */
    public static FailureGuidance forFailure(ConversionErrorCode code, String targetLabel) {
        return switch (code) {
            case EMPTY_PROGRAM -> new FailureGuidance(
                    "Could not understand the pseudocode structure for " + targetLabel + " conversion",
                    List.of(
                            "Use standard pseudocode keywords like START, END, IF, THEN, ELSE",
                            "Check that each line contains a complete statement",
                            "Try using simpler pseudocode constructs first",
                            "Ensure proper indentation for nested blocks"),
                    List.of(
                            "Do not use programming language-specific syntax",
                            "Avoid mixing different pseudocode styles",
                            "Do not leave incomplete statements"),
                    Severity.HIGH);
            case UNSUPPORTED_TARGET -> new FailureGuidance(
                    targetLabel + " is not currently supported for conversion",
                    List.of(
                            "Try selecting a different target language",
                            "Choose from Python, JavaScript, Java, C#, C++, Go, Rust or Pseudocode"),
                    List.of("Do not expect all programming languages to be supported"),
                    Severity.LOW);
            case EMISSION_FAILED -> new FailureGuidance(
                    "Conversion to " + targetLabel + " failed due to an internal error",
                    List.of(
                            "Check your pseudocode for syntax errors",
                            "Ensure all IF statements have matching END IF",
                            "Verify that loops have proper start and end markers",
                            "Try breaking complex logic into simpler steps"),
                    List.of(
                            "Do not use ambiguous variable names",
                            "Avoid deeply nested control structures",
                            "Do not mix pseudocode with actual code syntax"),
                    Severity.MEDIUM);
        };
    }

    /**
     * Builds the guidance for a flowchart that could not be drawn.
     *
     * @param code The failure code.
     * @return The guidance for that failure.
     */
    public static FailureGuidance forFlowchartFailure(ConversionErrorCode code) {
        if (code == ConversionErrorCode.EMPTY_PROGRAM) {
            return new FailureGuidance(
                    "Could not generate flowchart due to unrecognized pseudocode structure",
                    List.of(
                            "Use clear control flow statements (IF, WHILE, FOR)",
                            "Include START and END markers in your pseudocode",
                            "Ensure each step is on a separate line",
                            "Use descriptive names for variables and conditions"),
                    List.of(
                            "Avoid overly complex nested logic for flowcharts",
                            "Do not use programming-specific constructs",
                            "Avoid unclear or ambiguous step descriptions"),
                    Severity.MEDIUM);
        }
        return new FailureGuidance(
                "Flowchart generation encountered an unexpected error",
                List.of(
                        "Simplify the pseudocode structure",
                        "Break down complex operations into smaller steps",
                        "Use standard pseudocode conventions"),
                List.of(
                        "Avoid overly complex branching logic",
                        "Do not use unconventional pseudocode syntax"),
                Severity.MEDIUM);
    }

    /**
     * Returns a general remediation note for a kind of diagnostic.
     *
     * @param kind The diagnostic kind.
     * @return One sentence of advice.
     */
    public static String remediationNote(DiagnosticKind kind) {
        return switch (kind) {
            case MISSING_KEYWORD ->
                    "Close every IF with END IF, every WHILE with END WHILE and every FOR with NEXT or END FOR, and write THEN after each IF condition.";
            case INCOMPLETE_STATEMENT ->
                    "Make sure INPUT names a variable, OUTPUT has something to show and both sides of an assignment are filled in.";
            case INVALID_SYNTAX ->
                    "Start each line with a known keyword (START, END, INPUT, OUTPUT, SET, IF, WHILE, FOR) or write an assignment such as x = 1.";
            case AMBIGUOUS_STRUCTURE ->
                    "Use one assignment per line, simple variable names and a separate IF block instead of ELSE IF.";
        };
    }
}
