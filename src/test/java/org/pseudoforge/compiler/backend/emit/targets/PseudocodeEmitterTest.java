package org.pseudoforge.compiler.backend.emit.targets;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.GuidanceCatalog;
import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;
import org.pseudoforge.compiler.frontend.parser.ParseResult;
import org.pseudoforge.compiler.frontend.parser.Parser;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link PseudocodeEmitter}, which reformats pseudocode into one canonical dialect.
 */
public class PseudocodeEmitterTest {

    private final PseudocodeEmitter emitter = new PseudocodeEmitter(4);

    /**
     * Verifies that dialect variants are rewritten to their canonical spelling.
     */
    @Test
    @Tag("unit")
    void testCanonicalForm() {
        // Arrange
        String source = """
                begin
                read n
                x <- n * 2
                while x > 0 do
                x := x - 1
                endwhile
                for i from 1 to n step 2
                display i
                next i
                stop
                """;

        // Act
        String code = emitter.emit(Parser.parse(source));

        // Assert
        assertThat(code).isEqualTo("""
                START
                INPUT n
                SET x = n * 2
                WHILE x > 0
                    SET x = x - 1
                END WHILE
                FOR i = 1 TO n STEP 2
                    OUTPUT i
                END FOR
                END
                """);
    }

    @Test
    @Tag("unit")
    void testMarkersAreAddedWhenMissing() {
        String code = emitter.emit(Parser.parse("IF a THEN\nELSE\nPRINT a\nENDIF"));

        assertThat(code).isEqualTo("""
                START
                IF a THEN
                ELSE
                    OUTPUT a
                END IF
                END
                """);
    }

    /**
     * Verifies the issue list written ahead of the program when parsing reported diagnostics.
     */
    @Test
    @Tag("unit")
    void testDiagnosticsHeader() {
        // Arrange
        ParseResult result = Parser.parse("PRINT 1\nhello");
        SyntaxDiagnostic diagnostic = result.diagnostics().get(0);

        // Act
        String code = emitter.emit(result);

        // Assert
        assertThat(code).startsWith("// Detected issues:\n"
                + "// 1. [InvalidSyntax] line 2: Unrecognized statement 'hello'\n"
                + "// Suggestion: " + diagnostic.suggestion() + "\n"
                + "// Notes:\n"
                + "// - " + GuidanceCatalog.remediationNote(DiagnosticKind.INVALID_SYNTAX) + "\n");
        assertThat(code).endsWith("START\nOUTPUT 1\nEND\n");
    }

    @Test
    @Tag("unit")
    void testNotesListEachKindOnce() {
        String code = emitter.emit(Parser.parse("hello\nworld\nPRINT"));

        assertThat(code).contains("// 1. ", "// 2. ", "// 3. ");
        assertThat(code.split("\n"))
                .filteredOn(line -> line.startsWith("// - "))
                .containsExactly(
                        "// - " + GuidanceCatalog.remediationNote(DiagnosticKind.INVALID_SYNTAX),
                        "// - " + GuidanceCatalog.remediationNote(DiagnosticKind.INCOMPLETE_STATEMENT));
    }

    /**
     * Verifies that reformatting reformatted output changes nothing.
     */
    @Test
    @Tag("unit")
    void testReformattingIsAFixpoint() {
        String source = "x = 1\nIF x > 0 THEN\nPRINT \"pos\"\nEND IF\nhello\nWHILE x < 3\nx = x + 1";

        String once = emitter.emit(Parser.parse(source));
        String twice = emitter.emit(Parser.parse(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @Tag("unit")
    void testReparsedOutputKeepsStatementKinds() {
        String source = """
                BEGIN
                // setup
                INPUT n
                SET total = 0
                FOR i = 1 TO n
                  IF i > 2 THEN
                    total = total + i
                  ELSE
                    PRINT i
                  END IF
                NEXT
                WHILE total > 10
                  total = total - 10
                END WHILE
                OUTPUT total
                END
                """;
        ParseResult first = Parser.parse(source);

        ParseResult second = Parser.parse(emitter.emit(first));

        assertThat(kinds(second.statements())).isEqualTo(kinds(first.statements()));
        assertThat(second.diagnostics()).isEmpty();
    }

    private static List<String> kinds(List<StatementNode> statements) {
        List<String> kinds = new ArrayList<>();
        for (StatementNode node : statements) {
            kinds.add(node.getClass().getSimpleName());
            kinds.addAll(kinds(node.getChildren()));
        }
        return kinds;
    }
}
