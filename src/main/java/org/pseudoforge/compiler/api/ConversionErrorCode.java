package org.pseudoforge.compiler.api;

/**
 * Unique, testable codes for the hard failures of a conversion.
 * This decouples callers and tests from the wording of the messages.
 */
public enum ConversionErrorCode {
    /** Parsing produced no top-level statement, so there is nothing to emit. */
    EMPTY_PROGRAM,
    /** The requested target identifier is not one of the supported targets. */
    UNSUPPORTED_TARGET,
    /** An emitter failed unexpectedly while generating its output. */
    EMISSION_FAILED
}
