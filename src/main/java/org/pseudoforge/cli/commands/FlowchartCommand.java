package org.pseudoforge.cli.commands;

import com.typesafe.config.ConfigException;
import org.pseudoforge.cli.CommandLineInterface;
import org.pseudoforge.cli.rendering.ConversionReportRenderer;
import org.pseudoforge.compiler.Converter;
import org.pseudoforge.compiler.ConverterOptions;
import org.pseudoforge.compiler.api.ConversionException;
import org.pseudoforge.compiler.api.FlowchartResult;
import org.pseudoforge.compiler.diagnostics.GuidanceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "flowchart", mixinStandardHelpOptions = true,
        description = "Draws a pseudocode file as a Mermaid flowchart.")
public class FlowchartCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FlowchartCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The pseudocode file, or - for standard input.")
    private File file;

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
        ConversionReportRenderer renderer = new ConversionReportRenderer();

        try {
            ConverterOptions options = ConverterOptions.fromConfig(parent.getConfig().getConfig("pseudoforge.converter"));
            String source = SourceReader.read(file, stdin);
            FlowchartResult result = new Converter(options).convertToFlowchart(source);
            if (format == OutputFormat.JSON) {
                out.println(renderer.write(renderer.toJson(result)));
            } else {
                out.print(result.diagramText());
                err.print(renderer.renderDiagnostics(result.diagnostics()));
            }
            return 0;
        } catch (ConversionException e) {
            LOG.debug("Flowchart failed: {}", e.getMessage());
            err.print(renderer.renderGuidance(GuidanceCatalog.forFlowchartFailure(e.getErrorCode())));
            return 1;
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            LOG.debug("Could not prepare flowchart", e);
            err.println("Error: " + e.getMessage());
            return 2;
        } finally {
            out.flush();
            err.flush();
        }
    }
}
