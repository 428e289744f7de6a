package org.pseudoforge.compiler.frontend.parser;

/**
 * The canonical statement kinds a line can be classified as.
 */
public enum StatementKind {
    START,
    END,
    COMMENT,
    INPUT,
    OUTPUT,
    IF,
    WHILE,
    FOR,
    ASSIGNMENT
}
