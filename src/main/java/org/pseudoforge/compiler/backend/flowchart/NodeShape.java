package org.pseudoforge.compiler.backend.flowchart;

/**
 * The Mermaid shapes used for flowchart nodes.
 */
public enum NodeShape {
    /** Start and End. */
    TERMINAL("([", "])"),
    /** Assignments. */
    PROCESS("[", "]"),
    /** Input and output. */
    DATA("[/", "/]"),
    /** IF, WHILE and FOR conditions. */
    DECISION("{", "}"),
    /** Synthetic merge and continuation points. */
    JUNCTION("((", "))");

    private final String open;
    private final String close;

    NodeShape(String open, String close) {
        this.open = open;
        this.close = close;
    }

    /**
     * @param quotedLabel The already quoted label.
     * @return The label wrapped in this shape's delimiters.
     */
    public String wrap(String quotedLabel) {
        return open + quotedLabel + close;
    }
}
