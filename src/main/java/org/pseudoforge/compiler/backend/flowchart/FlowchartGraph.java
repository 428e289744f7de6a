package org.pseudoforge.compiler.backend.flowchart;

import java.util.ArrayList;
import java.util.List;

/**
 * A Mermaid {@code graph TD} under construction. Node ids {@code A1, A2, ...} are handed out
 * in allocation order and lines are kept in the order they were added.
 */
public final class FlowchartGraph {

    private static final String INDENT = "    ";

    private final int maxLabelLength;
    private final List<String> lines = new ArrayList<>();
    private int nextId = 1;

    /**
     * @param maxLabelLength Labels longer than this are cut and end with {@code ...}.
     */
    public FlowchartGraph(int maxLabelLength) {
        if (maxLabelLength < 1) {
            throw new IllegalArgumentException("Label length must be positive: " + maxLabelLength);
        }
        this.maxLabelLength = maxLabelLength;
    }

    /**
     * Adds a node.
     * @param shape The node shape.
     * @param label The raw label.
     * @return The node's id number.
     */
    public int node(NodeShape shape, String label) {
        int id = nextId++;
        lines.add(INDENT + "A" + id + shape.wrap(quote(label)));
        return id;
    }

    /**
     * Adds an edge.
     * @param from The source node id.
     * @param to The target node id.
     * @param label The edge label, or {@code null} for an unlabeled edge.
     */
    public void edge(int from, int to, String label) {
        String arrow = label == null ? " --> " : " -->|" + label + "| ";
        lines.add(INDENT + "A" + from + arrow + "A" + to);
    }

    String quote(String label) {
        // Junction nodes are labeled with a single blank, which must survive.
        String text = label.isBlank() ? label : label.strip();
        if (text.length() > maxLabelLength) {
            text = text.substring(0, maxLabelLength) + "...";
        }
        return "\"" + text.replace("\"", "#quot;") + "\"";
    }

    /**
     * @return The diagram text.
     */
    public String render() {
        StringBuilder sb = new StringBuilder("graph TD\n");
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
