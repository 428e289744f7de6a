package org.pseudoforge.compiler.api;

import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of converting one pseudocode text into several targets.
 *
 * @param outputs     One entry per distinct requested target, in request order.
 * @param diagnostics The issues found while parsing, in encounter order.
 */
public record ConversionResult(
        List<TargetOutput> outputs,
        List<SyntaxDiagnostic> diagnostics
) {
    public ConversionResult {
        outputs = List.copyOf(outputs);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The generated text of every successful target, keyed by target in request order.
     */
    public Map<String, String> perTarget() {
        Map<String, String> texts = new LinkedHashMap<>();
        for (TargetOutput output : outputs) {
            if (output.success()) {
                texts.put(output.target(), output.text());
            }
        }
        return texts;
    }

    /**
     * @return The failures of all failed targets, in request order.
     */
    public List<ConversionFailure> failures() {
        return outputs.stream()
                .filter(o -> !o.success())
                .map(TargetOutput::failure)
                .toList();
    }

    /**
     * Looks up the outcome of one target.
     *
     * @param target The target identifier as requested.
     * @return The outcome, or empty if the target was not requested.
     */
    public Optional<TargetOutput> output(String target) {
        return outputs.stream().filter(o -> o.target().equals(target)).findFirst();
    }

    /**
     * @return {@code true} if every requested target produced text.
     */
    public boolean allSucceeded() {
        return outputs.stream().allMatch(TargetOutput::success);
    }

    /**
     * Creates the outcome of a successful target.
     *
     * @param target The target identifier.
     * @param text The generated text.
     * @param executionTimeMs The elapsed time.
     * @return The outcome.
     */
    public static TargetOutput success(String target, String text, long executionTimeMs) {
        return TargetOutput.succeeded(target, text, executionTimeMs);
    }

    /**
     * Creates the outcome of a failed target.
     *
     * @param failure The failure.
     * @param executionTimeMs The elapsed time.
     * @return The outcome.
     */
    public static TargetOutput failure(ConversionFailure failure, long executionTimeMs) {
        return TargetOutput.failed(failure, executionTimeMs);
    }
}
