package org.pseudoforge.cli.rendering;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pseudoforge.compiler.api.ConversionFailure;
import org.pseudoforge.compiler.api.ConversionResult;
import org.pseudoforge.compiler.api.FlowchartResult;
import org.pseudoforge.compiler.api.TargetOutput;
import org.pseudoforge.compiler.diagnostics.FailureGuidance;
import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;

import java.util.List;

/**
 * Renders conversion results for the terminal, either as readable text or as JSON.
 */
public class ConversionReportRenderer {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Renders every target as a titled section; failed targets show their guidance.
     */
    public String renderText(ConversionResult result) {
        StringBuilder sb = new StringBuilder();
        for (TargetOutput output : result.outputs()) {
            if (output.success()) {
                sb.append("=== ").append(output.target()).append(" ===\n");
                sb.append(output.text());
                if (!output.text().endsWith("\n")) {
                    sb.append('\n');
                }
            } else {
                sb.append("=== ").append(output.target()).append(" (failed) ===\n");
                appendGuidance(sb, output.failure().guidance());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the guidance for a failure that is not tied to a target, e.g. an empty flowchart.
     */
    public String renderGuidance(FailureGuidance guidance) {
        StringBuilder sb = new StringBuilder();
        appendGuidance(sb, guidance);
        return sb.toString();
    }

    private static void appendGuidance(StringBuilder sb, FailureGuidance guidance) {
        sb.append(guidance.userFriendlyMessage()).append(" (severity ").append(guidance.severity()).append(")\n");
        for (String fix : guidance.fixSuggestions()) {
            sb.append("  Try: ").append(fix).append('\n');
        }
        for (String avoid : guidance.avoidSuggestions()) {
            sb.append("  Avoid: ").append(avoid).append('\n');
        }
    }

    /**
     * Renders parse diagnostics, one per line with its suggestion. Empty if there are none.
     */
    public String renderDiagnostics(List<SyntaxDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Diagnostics:\n");
        for (SyntaxDiagnostic d : diagnostics) {
            sb.append("  ").append(d).append('\n');
            sb.append("    Suggestion: ").append(d.suggestion()).append('\n');
        }
        return sb.toString();
    }

    public ObjectNode toJson(ConversionResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("success", result.allSucceeded());
        ArrayNode outputs = root.putArray("outputs");
        for (TargetOutput output : result.outputs()) {
            ObjectNode node = outputs.addObject();
            node.put("target", output.target());
            node.put("success", output.success());
            node.put("executionTimeMs", output.executionTimeMs());
            if (output.success()) {
                node.put("text", output.text());
            } else {
                node.set("failure", failureJson(output.failure()));
            }
        }
        root.set("diagnostics", diagnosticsJson(result.diagnostics()));
        return root;
    }

    public ObjectNode toJson(FlowchartResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("diagram", result.diagramText());
        root.put("executionTimeMs", result.executionTimeMs());
        root.set("diagnostics", diagnosticsJson(result.diagnostics()));
        return root;
    }

    private ObjectNode failureJson(ConversionFailure failure) {
        ObjectNode node = mapper.createObjectNode();
        node.put("errorCode", failure.errorCode().name());
        node.put("message", failure.message());
        node.set("guidance", mapper.valueToTree(failure.guidance()));
        return node;
    }

    private ArrayNode diagnosticsJson(List<SyntaxDiagnostic> diagnostics) {
        ArrayNode array = mapper.createArrayNode();
        for (SyntaxDiagnostic d : diagnostics) {
            ObjectNode node = array.addObject();
            node.put("line", d.lineNumber());
            node.put("kind", d.kind().displayName());
            node.put("message", d.message());
            node.put("suggestion", d.suggestion());
        }
        return array;
    }

    /**
     * @return The JSON tree as indented text.
     */
    public String write(ObjectNode node) {
        return node.toPrettyString();
    }
}
