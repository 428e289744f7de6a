package org.pseudoforge.cli.commands;

import com.typesafe.config.ConfigException;
import org.pseudoforge.cli.CommandLineInterface;
import org.pseudoforge.cli.rendering.ConversionReportRenderer;
import org.pseudoforge.compiler.Converter;
import org.pseudoforge.compiler.ConverterOptions;
import org.pseudoforge.compiler.api.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Converts a pseudocode file into one or more target languages.")
public class ConvertCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ConvertCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The pseudocode file, or - for standard input.")
    private File file;

    @Option(names = {"-t", "--targets"}, split = ",",
            description = "Target languages, e.g. python,java. Defaults to pseudoforge.converter.default-targets.")
    private List<String> targets;

    @Option(names = "--format", defaultValue = "TEXT", description = "Output format: ${COMPLETION-CANDIDATES}.")
    private OutputFormat format;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    InputStream stdin = System.in;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        ConverterOptions options;
        try {
            options = ConverterOptions.fromConfig(parent.getConfig().getConfig("pseudoforge.converter"));
            source = SourceReader.read(file, stdin);
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            LOG.debug("Could not prepare conversion", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }

        ConversionResult result = new Converter(options).convert(source, targets);
        ConversionReportRenderer renderer = new ConversionReportRenderer();
        if (format == OutputFormat.JSON) {
            out.println(renderer.write(renderer.toJson(result)));
        } else {
            out.print(renderer.renderText(result));
            err.print(renderer.renderDiagnostics(result.diagnostics()));
        }
        out.flush();
        err.flush();
        return result.allSucceeded() ? 0 : 1;
    }
}
