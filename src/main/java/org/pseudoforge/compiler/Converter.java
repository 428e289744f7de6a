package org.pseudoforge.compiler;

import org.pseudoforge.compiler.api.ConversionErrorCode;
import org.pseudoforge.compiler.api.ConversionException;
import org.pseudoforge.compiler.api.ConversionFailure;
import org.pseudoforge.compiler.api.ConversionResult;
import org.pseudoforge.compiler.api.FlowchartResult;
import org.pseudoforge.compiler.api.IConverter;
import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.api.TargetOutput;
import org.pseudoforge.compiler.backend.emit.EmitterRegistry;
import org.pseudoforge.compiler.backend.emit.ICodeEmitter;
import org.pseudoforge.compiler.backend.flowchart.FlowchartEmitter;
import org.pseudoforge.compiler.diagnostics.GuidanceCatalog;
import org.pseudoforge.compiler.frontend.parser.ParseResult;
import org.pseudoforge.compiler.frontend.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The main converter implementation. It parses the pseudocode once and hands the tree to
 * the emitter of every requested target.
 * <p>
 * Each target succeeds or fails on its own. Instances hold no per-request state and are
 * thread-safe.
 */
public class Converter implements IConverter {

    private static final Logger LOG = LoggerFactory.getLogger(Converter.class);

    private final ConverterOptions options;
    private final EmitterRegistry emitters;
    private final FlowchartEmitter flowchartEmitter;

    /**
     * Constructs a converter with the default options.
     */
    public Converter() {
        this(ConverterOptions.defaults());
    }

    /**
     * Constructs a converter with the default emitters.
     * @param options The converter settings.
     */
    public Converter(ConverterOptions options) {
        this(options, EmitterRegistry.initializeWithDefaults(options.indentWidth()));
    }

    /**
     * Constructs a converter with explicit emitters.
     * @param options The converter settings.
     * @param emitters The emitter for each target.
     */
    public Converter(ConverterOptions options, EmitterRegistry emitters) {
        this.options = options;
        this.emitters = emitters;
        this.flowchartEmitter = new FlowchartEmitter(options.maxLabelLength());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A {@code null} target list means the configured default targets. Identifiers are
     * compared ignoring case and surrounding whitespace; repeated identifiers are converted once.
     */
    @Override
    public ConversionResult convert(String pseudocode, List<String> targets) {
        List<String> requested = normalizeTargets(targets == null ? options.defaultTargets() : targets);
        ParseResult program = Parser.parse(pseudocode);

        Stream<String> stream = options.parallelEmission() && requested.size() > 1
                ? requested.parallelStream()
                : requested.stream();
        List<TargetOutput> outputs = stream.map(target -> convertOne(program, target)).toList();

        long failed = outputs.stream().filter(o -> !o.success()).count();
        LOG.debug("Converted to {} targets, {} failed, {} diagnostics",
                outputs.size(), failed, program.diagnostics().size());
        return new ConversionResult(outputs, program.diagnostics());
    }

    private TargetOutput convertOne(ParseResult program, String target) {
        long start = System.nanoTime();
        Optional<TargetLanguage> language = TargetLanguage.fromId(target);
        if (language.isEmpty()) {
            LOG.warn("Unsupported target '{}'", target);
            return failure(target, target, ConversionErrorCode.UNSUPPORTED_TARGET,
                    "Unsupported target: " + target, start);
        }
        String label = language.get().displayName();
        if (program.isEmpty()) {
            return failure(target, label, ConversionErrorCode.EMPTY_PROGRAM,
                    "No valid pseudocode statements found", start);
        }
        Optional<ICodeEmitter> emitter = emitters.get(language.get());
        if (emitter.isEmpty()) {
            LOG.warn("No emitter registered for target '{}'", target);
            return failure(target, label, ConversionErrorCode.UNSUPPORTED_TARGET,
                    "No emitter registered for " + label, start);
        }
        try {
            String text = emitter.get().emit(program);
            long elapsed = elapsedMs(start);
            LOG.debug("Emitted {} ({} characters) in {} ms", target, text.length(), elapsed);
            return ConversionResult.success(target, text, elapsed);
        } catch (RuntimeException e) {
            LOG.warn("Emitter for '{}' failed: {}", target, e.getMessage(), e);
            return failure(target, label, ConversionErrorCode.EMISSION_FAILED,
                    "Conversion to " + label + " failed: " + e.getMessage(), start);
        }
    }

    private static TargetOutput failure(String target, String label, ConversionErrorCode code, String message, long start) {
        ConversionFailure failure = new ConversionFailure(target, code, message, GuidanceCatalog.forFailure(code, label));
        return ConversionResult.failure(failure, elapsedMs(start));
    }

    @Override
    public FlowchartResult convertToFlowchart(String pseudocode) throws ConversionException {
        long start = System.nanoTime();
        ParseResult program = Parser.parse(pseudocode);
        if (program.isEmpty()) {
            throw new ConversionException(ConversionErrorCode.EMPTY_PROGRAM,
                    "No valid pseudocode statements found for flowchart generation");
        }
        String diagram = flowchartEmitter.emit(program);
        long elapsed = elapsedMs(start);
        LOG.debug("Drew flowchart ({} lines) in {} ms", diagram.lines().count(), elapsed);
        return new FlowchartResult(diagram, program.diagnostics(), elapsed);
    }

    private static List<String> normalizeTargets(List<String> targets) {
        Set<String> seen = new LinkedHashSet<>();
        for (String target : targets) {
            if (target != null) {
                seen.add(target.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(seen);
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(1, (System.nanoTime() - startNanos) / 1_000_000);
    }
}
