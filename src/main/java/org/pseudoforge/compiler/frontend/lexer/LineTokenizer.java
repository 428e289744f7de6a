package org.pseudoforge.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw pseudocode into trimmed, numbered, non-blank {@link Line}s.
 * <p>
 * Blank lines are dropped but still counted, so line numbers always refer to the original text.
 */
public class LineTokenizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final String source;

    /**
     * Constructs a new LineTokenizer.
     * @param source The raw pseudocode, may be {@code null}.
     */
    public LineTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Scans the source.
     * @return The non-blank lines in source order.
     */
    public List<Line> scanLines() {
        List<Line> lines = new ArrayList<>();
        if (source.isEmpty()) {
            return lines;
        }
        String[] rawLines = LINE_BREAK.split(source, -1);
        for (int i = 0; i < rawLines.length; i++) {
            String content = rawLines[i].strip();
            if (!content.isEmpty()) {
                lines.add(new Line(content, i + 1));
            }
        }
        return lines;
    }
}
