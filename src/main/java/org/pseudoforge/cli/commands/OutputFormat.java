package org.pseudoforge.cli.commands;

/**
 * How a command prints its result.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
