package org.pseudoforge.compiler.api;

import org.pseudoforge.compiler.diagnostics.FailureGuidance;

/**
 * Describes why one target of a conversion produced no output.
 *
 * @param target    The target identifier as requested.
 * @param errorCode The failure code.
 * @param message   The technical message.
 * @param guidance  Advice to show to the user.
 */
public record ConversionFailure(
        String target,
        ConversionErrorCode errorCode,
        String message,
        FailureGuidance guidance
) {
}
