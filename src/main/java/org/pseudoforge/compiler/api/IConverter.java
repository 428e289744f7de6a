package org.pseudoforge.compiler.api;

import java.util.List;

/**
 * Defines the public interface of the pseudocode converter.
 */
public interface IConverter {

    /**
     * Converts pseudocode into each requested target.
     * <p>
     * A failing target never affects the others: unknown identifiers and empty programs are
     * reported per target in the result.
     *
     * @param pseudocode The pseudocode text.
     * @param targets    The requested target identifiers, see {@link TargetLanguage}.
     * @return The per-target outcomes together with the parse diagnostics.
     */
    ConversionResult convert(String pseudocode, List<String> targets);

    /**
     * Draws a Mermaid flowchart of the pseudocode.
     *
     * @param pseudocode The pseudocode text.
     * @return The diagram text together with the parse diagnostics.
     * @throws ConversionException with {@link ConversionErrorCode#EMPTY_PROGRAM} if the text
     *                             contains no statement.
     */
    FlowchartResult convertToFlowchart(String pseudocode) throws ConversionException;
}
