package org.pseudoforge.compiler.api;

/**
 * Thrown when a conversion cannot produce any output for a target.
 * <p>
 * Recoverable parsing issues are never reported through this exception; they are collected as
 * {@link org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic}s instead.
 */
public class ConversionException extends Exception {

    private final ConversionErrorCode errorCode;

    /**
     * Constructs a new conversion exception.
     * @param errorCode The failure code.
     * @param message The detail message.
     */
    public ConversionException(ConversionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * @return The failure code.
     */
    public ConversionErrorCode getErrorCode() {
        return errorCode;
    }
}
