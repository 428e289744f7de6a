package org.pseudoforge.compiler.api;

import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;

import java.util.List;

/**
 * The result of drawing a flowchart from pseudocode.
 *
 * @param diagramText     The Mermaid {@code graph TD} description.
 * @param diagnostics     The issues found while parsing, in encounter order.
 * @param executionTimeMs The time spent, at least 1 ms.
 */
public record FlowchartResult(
        String diagramText,
        List<SyntaxDiagnostic> diagnostics,
        long executionTimeMs
) {
    public FlowchartResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
