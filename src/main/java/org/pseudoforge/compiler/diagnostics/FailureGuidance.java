package org.pseudoforge.compiler.diagnostics;

import java.util.List;

/**
 * User-facing advice attached to a failed conversion.
 *
 * @param userFriendlyMessage A plain-language description of what went wrong.
 * @param fixSuggestions      Steps that are likely to fix the problem.
 * @param avoidSuggestions    Habits that tend to cause the problem.
 * @param severity            How much of the request is affected.
 */
public record FailureGuidance(
        String userFriendlyMessage,
        List<String> fixSuggestions,
        List<String> avoidSuggestions,
        Severity severity
) {
    public FailureGuidance {
        fixSuggestions = List.copyOf(fixSuggestions);
        avoidSuggestions = List.copyOf(avoidSuggestions);
    }

    /**
     * The severity of a failure as presented to the user.
     */
    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }
}
