package org.pseudoforge.compiler.backend.emit;

/**
 * An indentation-aware line buffer.
 */
public final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private final String unit;
    private int level;

    /**
     * @param indentWidth The number of spaces per nesting level.
     */
    public CodeWriter(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
        this.unit = " ".repeat(indentWidth);
    }

    /**
     * Writes one line at the current indentation. An empty line carries no indentation.
     * @param text The line content.
     * @return this writer.
     */
    public CodeWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(unit.repeat(level));
        }
        out.append(text).append('\n');
        return this;
    }

    /**
     * @return this writer, after writing an empty line.
     */
    public CodeWriter blank() {
        return line("");
    }

    public CodeWriter indent() {
        level++;
        return this;
    }

    public CodeWriter dedent() {
        if (level == 0) {
            throw new IllegalStateException("Cannot dedent below level 0");
        }
        level--;
        return this;
    }

    public int level() {
        return level;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
