package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.DiagnosticsEngine;
import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;
import org.pseudoforge.compiler.frontend.lexer.LineTokenizer;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.EndNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StartNode;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify how lines become statements and which diagnostics malformed input yields.
 * These are unit tests and do not require external resources.
 */
public class ParserTest {

    /**
     * Verifies that an empty text parses to an empty program without diagnostics.
     */
    @Test
    @Tag("unit")
    void testEmptyInput() {
        ParseResult result = Parser.parse("");

        assertThat(result.statements()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.hasInput()).isFalse();
        assertThat(result.hasOutput()).isFalse();
        assertThat(result.variables()).isEmpty();
    }

    /**
     * Verifies a simple linear program with markers, an assignment and an output.
     */
    @Test
    @Tag("unit")
    void testLinearProgram() {
        // Arrange
        String source = "BEGIN\n  SET x = 10\n  PRINT x\nEND";

        // Act
        ParseResult result = Parser.parse(source);

        // Assert
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.statements()).hasSize(4);
        assertThat(result.statements().get(0)).isInstanceOf(StartNode.class);
        assertThat(result.statements().get(1)).isEqualTo(new AssignmentNode("SET x = 10", 2, "x", "10", "="));
        assertThat(result.statements().get(2)).isEqualTo(new OutputNode("PRINT x", 3, "x"));
        assertThat(result.statements().get(3)).isInstanceOf(EndNode.class);
        assertThat(result.variables()).containsExactly("x");
        assertThat(result.hasOutput()).isTrue();
        assertThat(result.hasInput()).isFalse();
    }

    /**
     * Verifies that an IF without END IF keeps its body and reports one missing keyword at its line.
     */
    @Test
    @Tag("unit")
    void testUnclosedIfReportsMissingKeyword() {
        ParseResult result = Parser.parse("IF x > 0 THEN\nPRINT \"hi\"");

        assertThat(result.statements()).hasSize(1);
        IfNode ifNode = (IfNode) result.statements().get(0);
        assertThat(ifNode.conditionExpression()).isEqualTo("x > 0");
        assertThat(ifNode.thenBody()).containsExactly(new OutputNode("PRINT \"hi\"", 2, "\"hi\""));
        assertThat(ifNode.elseBody()).isEmpty();
        assertThat(result.diagnostics()).hasSize(1);
        SyntaxDiagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.MISSING_KEYWORD);
        assertThat(diagnostic.lineNumber()).isEqualTo(1);
        assertThat(diagnostic.suggestion()).contains("END IF");
    }

    @Test
    @Tag("unit")
    void testIfElse() {
        String source = """
                IF a > b THEN
                  max = a
                ELSE
                  max = b
                END IF
                """;

        ParseResult result = Parser.parse(source);

        assertThat(result.diagnostics()).isEmpty();
        IfNode ifNode = (IfNode) result.statements().get(0);
        assertThat(ifNode.thenBody()).extracting(n -> ((AssignmentNode) n).valueExpression()).containsExactly("a");
        assertThat(ifNode.elseBody()).extracting(n -> ((AssignmentNode) n).valueExpression()).containsExactly("b");
        assertThat(ifNode.getChildren()).hasSize(2);
    }

    /**
     * Verifies that ELSE IF is flattened into the ELSE branch and that all later branches are kept.
     */
    @Test
    @Tag("unit")
    void testElseIfIsFlattened() {
        // Arrange
        String source = """
                IF a > 1 THEN
                  PRINT "big"
                ELSE IF a > 0 THEN
                  PRINT "small"
                ELSE
                  PRINT "none"
                END IF
                PRINT "done"
                """;

        // Act
        ParseResult result = Parser.parse(source);

        // Assert
        assertThat(result.statements()).hasSize(2);
        IfNode ifNode = (IfNode) result.statements().get(0);
        assertThat(ifNode.thenBody()).hasSize(1);
        assertThat(ifNode.elseBody()).extracting(n -> ((OutputNode) n).message())
                .containsExactly("\"small\"", "\"none\"");
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(result.diagnostics().get(0).lineNumber()).isEqualTo(3);
        assertThat(result.diagnostics().get(0).message()).contains("a > 0");
    }

    @Test
    @Tag("unit")
    void testSecondElseIsReported() {
        String source = "IF a THEN\nx = 1\nELSE\nx = 2\nELSE\nx = 3\nEND IF";

        ParseResult result = Parser.parse(source);

        IfNode ifNode = (IfNode) result.statements().get(0);
        assertThat(ifNode.elseBody()).hasSize(2);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(result.diagnostics().get(0).lineNumber()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void testIfWithoutThen() {
        ParseResult result = Parser.parse("IF x > 1\nPRINT x\nEND IF");

        IfNode ifNode = (IfNode) result.statements().get(0);
        assertThat(ifNode.conditionExpression()).isEqualTo("x > 1");
        assertThat(ifNode.thenBody()).hasSize(1);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.MISSING_KEYWORD);
    }

    /**
     * Verifies that an unclosed inner block gives way to the terminator of its enclosing block.
     */
    @Test
    @Tag("unit")
    void testUnclosedInnerBlockInsideClosedOuterBlock() {
        // Arrange
        String source = """
                WHILE n < 3
                  IF n = 1 THEN
                    PRINT n
                  SET n = n + 1
                END WHILE
                PRINT "after"
                """;

        // Act
        ParseResult result = Parser.parse(source);

        // Assert
        assertThat(result.statements()).hasSize(2);
        WhileNode loop = (WhileNode) result.statements().get(0);
        assertThat(loop.body()).hasSize(1);
        IfNode inner = (IfNode) loop.body().get(0);
        assertThat(inner.thenBody()).hasSize(2);
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.MISSING_KEYWORD);
        assertThat(result.diagnostics().get(0).lineNumber()).isEqualTo(2);
        assertThat(result.diagnostics().get(0).message()).contains("END WHILE");
    }

    @Test
    @Tag("unit")
    void testMatchedBlocksProduceNoMissingKeyword() {
        String source = """
                START
                FOR i = 1 TO 3
                  WHILE x < i DO
                    IF x = 2 THEN
                      PRINT x
                    ELSE
                      PRINT 0
                    ENDIF
                    x = x + 1
                  ENDWHILE
                NEXT i
                END
                """;

        ParseResult result = Parser.parse(source);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.statements()).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testStrayTerminatorIsReportedAndSkipped() {
        ParseResult result = Parser.parse("PRINT 1\nEND IF\nPRINT 2");

        assertThat(result.statements()).hasSize(2);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(result.diagnostics().get(0).lineNumber()).isEqualTo(2);
    }

    /**
     * Verifies that statements written on the same line as ELSE or END IF are reported, not lost silently.
     */
    @Test
    @Tag("unit")
    void testTextAfterIfKeywordsIsReported() {
        // Act
        ParseResult afterElse = Parser.parse("IF a THEN\nPRINT 1\nELSE PRINT 2\nEND IF");
        ParseResult afterEndIf = Parser.parse("IF a THEN\nPRINT 1\nEND IF PRINT 2");

        // Assert
        assertThat(((IfNode) afterElse.statements().get(0)).elseBody()).isEmpty();
        assertThat(afterElse.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.AMBIGUOUS_STRUCTURE);
            assertThat(d.lineNumber()).isEqualTo(3);
            assertThat(d.message()).contains("PRINT 2").contains("ELSE");
        });
        assertThat(afterEndIf.statements()).hasSize(1);
        assertThat(afterEndIf.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.AMBIGUOUS_STRUCTURE);
            assertThat(d.lineNumber()).isEqualTo(3);
            assertThat(d.message()).contains("PRINT 2").contains("END IF");
        });
    }

    @Test
    @Tag("unit")
    void testTextAfterLoopTerminatorsIsReported() {
        ParseResult whileLoop = Parser.parse("WHILE n > 0\nn = n - 1\nEND WHILE PRINT n");
        ParseResult forLoop = Parser.parse("FOR i = 1 TO 3\nPRINT i\nEND FOR PRINT i");
        ParseResult wrongCounter = Parser.parse("FOR i = 1 TO 3\nPRINT i\nNEXT j");
        ParseResult sameCounter = Parser.parse("FOR i = 1 TO 3\nPRINT i\nnext I");

        assertThat(whileLoop.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(forLoop.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(wrongCounter.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(sameCounter.diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testForLoopForms() {
        ParseResult result = Parser.parse("""
                FOR i FROM 1 TO 3
                  PRINT i
                NEXT i
                FOR j = 10 TO 1 STEP -2 DO
                  PRINT j
                END FOR
                for k=0 to n - 1
                endfor
                """);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.statements()).hasSize(3);
        ForNode first = (ForNode) result.statements().get(0);
        assertThat(first.loopVariable()).isEqualTo("i");
        assertThat(first.startExpr()).isEqualTo("1");
        assertThat(first.endExpr()).isEqualTo("3");
        assertThat(first.stepExpr()).isEqualTo("1");
        assertThat(first.body()).hasSize(1);
        ForNode second = (ForNode) result.statements().get(1);
        assertThat(second.stepExpr()).isEqualTo("-2");
        assertThat(second.endExpr()).isEqualTo("1");
        ForNode third = (ForNode) result.statements().get(2);
        assertThat(third.loopVariable()).isEqualTo("k");
        assertThat(third.endExpr()).isEqualTo("n - 1");
        assertThat(third.body()).isEmpty();
        assertThat(result.variables()).containsExactly("i", "j", "k");
    }

    @Test
    @Tag("unit")
    void testMalformedForIsInvalidSyntax() {
        ParseResult result = Parser.parse("FOR every item\nPRINT item\nNEXT");

        assertThat(result.statements()).hasSize(1);
        assertThat(result.statements().get(0)).isInstanceOf(OutputNode.class);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.INVALID_SYNTAX, DiagnosticKind.AMBIGUOUS_STRUCTURE);
    }

    @Test
    @Tag("unit")
    void testWhileStripsTrailingDo() {
        ParseResult result = Parser.parse("WHILE count < 10 DO\ncount = count + 1\nEND WHILE");

        WhileNode loop = (WhileNode) result.statements().get(0);
        assertThat(loop.conditionExpression()).isEqualTo("count < 10");
        assertThat(loop.body()).hasSize(1);
    }

    /**
     * Verifies that a block with an empty condition is still parsed.
     */
    @Test
    @Tag("unit")
    void testEmptyConditionStillParsesBlock() {
        ParseResult result = Parser.parse("WHILE\nPRINT 1\nEND WHILE\nIF THEN\nPRINT 2\nEND IF");

        assertThat(result.statements()).hasSize(2);
        assertThat(((WhileNode) result.statements().get(0)).body()).hasSize(1);
        assertThat(((IfNode) result.statements().get(1)).thenBody()).hasSize(1);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.INCOMPLETE_STATEMENT, DiagnosticKind.INCOMPLETE_STATEMENT);
    }

    @Test
    @Tag("unit")
    void testInputAndOutputTracking() {
        ParseResult result = Parser.parse("READ age\nGET name\nDISPLAY \"Hi \" + name");

        assertThat(result.statements()).containsExactly(
                new InputNode("READ age", 1, "age"),
                new InputNode("GET name", 2, "name"),
                new OutputNode("DISPLAY \"Hi \" + name", 3, "\"Hi \" + name"));
        assertThat(result.hasInput()).isTrue();
        assertThat(result.hasOutput()).isTrue();
        assertThat(result.variables()).containsExactly("age", "name");
    }

    /**
     * Verifies that incomplete statements are dropped and leave the usage flags untouched.
     */
    @Test
    @Tag("unit")
    void testIncompleteStatementsAreDropped() {
        ParseResult result = Parser.parse("INPUT\nPRINT\nx =\n= 5");

        assertThat(result.statements()).isEmpty();
        assertThat(result.hasInput()).isFalse();
        assertThat(result.hasOutput()).isFalse();
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind).containsOnly(DiagnosticKind.INCOMPLETE_STATEMENT);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::lineNumber).containsExactly(1, 2, 3, 4);
    }

    /**
     * Verifies that a bare SET or LET prefix leaves the assignment without a target.
     */
    @Test
    @Tag("unit")
    void testPrefixWithoutTargetIsIncomplete() {
        ParseResult result = Parser.parse("SET = 3\nlet := 4");

        assertThat(result.statements()).isEmpty();
        assertThat(result.variables()).isEmpty();
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.INCOMPLETE_STATEMENT, DiagnosticKind.INCOMPLETE_STATEMENT);
    }

    @Test
    @Tag("unit")
    void testAmbiguousAssignments() {
        ParseResult result = Parser.parse("x = y = 3\n3x = 4\ntotal := 1");

        assertThat(result.statements()).containsExactly(new AssignmentNode("total := 1", 3, "total", "1", ":="));
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind)
                .containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE, DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(result.variables()).containsExactly("total");
    }

    @Test
    @Tag("unit")
    void testAssignmentOperatorsAndPrefixes() {
        ParseResult result = Parser.parse("LET a <- 5\nSET b := a * 2\nscores[i] = 0\nmsg = \"x = y\"");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.statements()).extracting(n -> ((AssignmentNode) n).targetVariable())
                .containsExactly("a", "b", "scores[i]", "msg");
        assertThat(result.statements()).extracting(n -> ((AssignmentNode) n).operator())
                .containsExactly("<-", ":=", "=", "=");
        assertThat(((AssignmentNode) result.statements().get(3)).valueExpression()).isEqualTo("\"x = y\"");
        assertThat(result.variables()).containsExactly("a", "b", "scores", "msg");
    }

    @Test
    @Tag("unit")
    void testUnknownLineIsInvalidSyntax() {
        ParseResult result = Parser.parse("hello world\nPRINT 1");

        assertThat(result.statements()).hasSize(1);
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind).containsExactly(DiagnosticKind.INVALID_SYNTAX);
        assertThat(result.diagnostics().get(0).suggestion()).isNotBlank();
    }

    @Test
    @Tag("unit")
    void testInputListReadsFirstVariable() {
        ParseResult result = Parser.parse("INPUT a, b");

        assertThat(result.statements()).containsExactly(new InputNode("INPUT a, b", 1, "a"));
        assertThat(result.diagnostics()).extracting(SyntaxDiagnostic::kind).containsExactly(DiagnosticKind.AMBIGUOUS_STRUCTURE);
        assertThat(result.diagnostics().get(0).message()).contains("b");
    }

    @Test
    @Tag("unit")
    void testCommentsAreKeptVerbatim() {
        ParseResult result = Parser.parse("// first\n# second\n/* third */");

        assertThat(result.statements()).containsExactly(
                new CommentNode("// first", 1),
                new CommentNode("# second", 2),
                new CommentNode("/* third */", 3));
    }

    @Test
    @Tag("unit")
    void testKeywordsIgnoreCase() {
        ParseResult result = Parser.parse("begin\nif x then\nprint x\nelse\nprint y\nend if\nend");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.statements()).hasSize(3);
        assertThat(result.statements().get(1)).isInstanceOf(IfNode.class);
    }

    @Test
    @Tag("unit")
    void testCustomKeywordTable() {
        KeywordTable table = KeywordTable.defaults()
                .with(new KeywordTable.Entry("SHOW", StatementKind.OUTPUT, KeywordTable.MatchMode.WORD));
        Parser parser = new Parser(new LineTokenizer("SHOW total").scanLines(), new DiagnosticsEngine(), table);

        ParseResult result = parser.parse();

        assertThat(result.statements()).containsExactly(new OutputNode("SHOW total", 1, "total"));
    }

    /**
     * Verifies that parsing is deterministic.
     */
    @Test
    @Tag("unit")
    void testParsingIsDeterministic() {
        String source = "IF a THEN\nx = 1\nELSE IF b THEN\ny = 2\nhello\nWHILE c\nNEXT";

        assertThat(Parser.parse(source)).isEqualTo(Parser.parse(source));
    }
}
