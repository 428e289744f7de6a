package org.pseudoforge.compiler;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Settings of a {@link Converter}. Immutable.
 *
 * @param indentWidth        Spaces per nesting level in generated code.
 * @param parallelEmission   Whether targets of one request are emitted concurrently.
 * @param defaultTargets     The targets used when a caller names none.
 * @param maxLabelLength     The longest flowchart label before it is cut.
 */
public record ConverterOptions(
        int indentWidth,
        boolean parallelEmission,
        List<String> defaultTargets,
        int maxLabelLength
) {
    public ConverterOptions {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indent-width must not be negative: " + indentWidth);
        }
        if (maxLabelLength < 1) {
            throw new IllegalArgumentException("flowchart.max-label-length must be positive: " + maxLabelLength);
        }
        defaultTargets = List.copyOf(defaultTargets);
    }

    /**
     * @return The built-in defaults, identical to those in {@code reference.conf}.
     */
    public static ConverterOptions defaults() {
        return new ConverterOptions(4, false, List.of("pseudocode", "python"), 30);
    }

    /**
     * Reads the options from a converter configuration block.
     *
     * @param config The {@code pseudoforge.converter} block.
     * @return The options; keys missing from the block keep their defaults.
     */
    public static ConverterOptions fromConfig(Config config) {
        ConverterOptions d = defaults();
        return new ConverterOptions(
                config.hasPath("indent-width") ? config.getInt("indent-width") : d.indentWidth(),
                config.hasPath("parallel-emission") ? config.getBoolean("parallel-emission") : d.parallelEmission(),
                config.hasPath("default-targets") ? config.getStringList("default-targets") : d.defaultTargets(),
                config.hasPath("flowchart.max-label-length") ? config.getInt("flowchart.max-label-length") : d.maxLabelLength());
    }
}
