package org.pseudoforge.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pseudoforge.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the {@code convert} subcommand, run through the full command line.
 */
public class ConvertCommandTest {

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

    /**
     * Verifies that every requested target is printed as its own section.
     */
    @Test
    @Tag("integration")
    void testConvertPrintsEveryTarget() throws IOException {
        // Arrange
        Path file = write("SET x = 10\nPRINT x\n");

        // Act
        int exitCode = commandLine.execute("convert", "-f", file.toString(), "-t", "python,go");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("=== python ===\n", "print(x)", "=== go ===\n", "fmt.Println(x)");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that one unsupported target fails the run without hiding the others.
     */
    @Test
    @Tag("integration")
    void testUnsupportedTargetExitsWithOne() throws IOException {
        Path file = write("PRINT 1\n");

        int exitCode = commandLine.execute("convert", "-f", file.toString(), "-t", "python,cobol");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("=== python ===", "=== cobol (failed) ===",
                "cobol is not currently supported for conversion (severity LOW)", "  Try: ");
    }

    @Test
    @Tag("integration")
    void testDiagnosticsGoToStandardError() throws IOException {
        Path file = write("IF x > 0 THEN\nPRINT x\n");

        int exitCode = commandLine.execute("convert", "-f", file.toString(), "-t", "pseudocode");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("// Detected issues:", "END IF");
        assertThat(err.toString()).startsWith("Diagnostics:\n  [MissingKeyword] line 1: ")
                .contains("    Suggestion: Add END IF");
    }

    /**
     * Verifies the JSON report, including a per-target failure.
     */
    @Test
    @Tag("integration")
    void testJsonFormat() throws IOException {
        // Arrange
        Path file = write("PRINT \"hi\"\nhello\n");

        // Act
        int exitCode = commandLine.execute("convert", "-f", file.toString(), "-t", "java,cobol", "--format", "json");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("success").asBoolean()).isFalse();
        assertThat(root.get("outputs")).hasSize(2);
        assertThat(root.get("outputs").get(0).get("target").asText()).isEqualTo("java");
        assertThat(root.get("outputs").get(0).get("text").asText()).contains("System.out.println(\"hi\");");
        JsonNode failure = root.get("outputs").get(1).get("failure");
        assertThat(failure.get("errorCode").asText()).isEqualTo("UNSUPPORTED_TARGET");
        assertThat(failure.get("guidance").get("severity").asText()).isEqualTo("LOW");
        assertThat(root.get("diagnostics").get(0).get("kind").asText()).isEqualTo("InvalidSyntax");
        assertThat(root.get("diagnostics").get(0).get("line").asInt()).isEqualTo(2);
    }

    @Test
    @Tag("integration")
    void testReadsStandardInput() {
        ConvertCommand convert = commandLine.getSubcommands().get("convert").getCommand();
        convert.stdin = new ByteArrayInputStream("PRINT 42\n".getBytes(StandardCharsets.UTF_8));

        int exitCode = commandLine.execute("convert", "-f", "-", "-t", "rust");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("println!(\"{}\", 42);");
    }

    @Test
    @Tag("integration")
    void testDefaultTargetsFromConfiguration() throws IOException {
        Path file = write("PRINT 1\n");
        Path conf = tempDir.resolve("custom.conf");
        Files.writeString(conf, "pseudoforge.converter.default-targets = [cpp]\n", StandardCharsets.UTF_8);

        int exitCode = commandLine.execute("-c", conf.toString(), "convert", "-f", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("=== cpp ===").doesNotContain("=== python ===");
    }

    @Test
    @Tag("integration")
    void testMissingFileExitsWithTwo() {
        int exitCode = commandLine.execute("convert", "-f", tempDir.resolve("nope.txt").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    @Tag("integration")
    void testEmptyProgramExitsWithOne() throws IOException {
        Path file = write("\n\n");

        int exitCode = commandLine.execute("convert", "-f", file.toString(), "-t", "python");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("=== python (failed) ===",
                "Could not understand the pseudocode structure for Python conversion");
    }
}
