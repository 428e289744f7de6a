package org.pseudoforge.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pseudoforge.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the {@code flowchart} subcommand.
 */
public class FlowchartCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        commandLine = CommandLineInterface.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("program.txt");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @Tag("integration")
    void testPrintsDiagram() throws IOException {
        Path file = write("INPUT n\nPRINT n\n");

        int exitCode = commandLine.execute("flowchart", "-f", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("graph TD\n").contains("A2[/\"Input: n\"/]");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testJsonFormat() throws IOException {
        Path file = write("PRINT n\nwhat\n");

        int exitCode = commandLine.execute("flowchart", "-f", file.toString(), "--format", "JSON");

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("diagram").asText()).startsWith("graph TD");
        assertThat(root.get("diagnostics")).hasSize(1);
        assertThat(root.get("executionTimeMs").asLong()).isPositive();
    }

    /**
     * Verifies that an empty program prints the flowchart guidance and exits with 1.
     */
    @Test
    @Tag("integration")
    void testEmptyProgramShowsGuidance() throws IOException {
        Path file = write("   \n");

        int exitCode = commandLine.execute("flowchart", "-f", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("Could not generate flowchart due to unrecognized pseudocode structure (severity MEDIUM)")
                .contains("  Avoid: ");
    }
}
