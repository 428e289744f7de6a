package org.pseudoforge.compiler.api;

/**
 * The outcome of converting one requested target.
 *
 * @param target          The target identifier as requested.
 * @param text            The generated text, or {@code null} if the target failed.
 * @param failure         The failure, or {@code null} if the target succeeded.
 * @param executionTimeMs The time spent on this target, at least 1 ms.
 */
public record TargetOutput(
        String target,
        String text,
        ConversionFailure failure,
        long executionTimeMs
) {
    /**
     * @return {@code true} if the target produced text.
     */
    public boolean success() {
        return failure == null;
    }

    static TargetOutput succeeded(String target, String text, long executionTimeMs) {
        return new TargetOutput(target, text, null, executionTimeMs);
    }

    static TargetOutput failed(ConversionFailure failure, long executionTimeMs) {
        return new TargetOutput(failure.target(), null, failure, executionTimeMs);
    }
}
