package org.pseudoforge.compiler.diagnostics;

/**
 * The category of a {@link SyntaxDiagnostic}.
 */
public enum DiagnosticKind {
    /** A block or clause keyword (e.g. THEN, END IF, NEXT) is missing. */
    MISSING_KEYWORD("MissingKeyword"),
    /** A statement lacks a required part, such as the variable of an INPUT. */
    INCOMPLETE_STATEMENT("IncompleteStatement"),
    /** A line does not match any known statement form. */
    INVALID_SYNTAX("InvalidSyntax"),
    /** A line could be read more than one way, or was simplified while parsing. */
    AMBIGUOUS_STRUCTURE("AmbiguousStructure");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name shown to users, e.g. {@code MissingKeyword}.
     */
    public String displayName() {
        return displayName;
    }
}
