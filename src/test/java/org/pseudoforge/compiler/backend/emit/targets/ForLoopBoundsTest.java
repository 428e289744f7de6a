package org.pseudoforge.compiler.backend.emit.targets;

import org.pseudoforge.compiler.api.TargetLanguage;
import org.pseudoforge.compiler.backend.emit.EmitterRegistry;
import org.pseudoforge.compiler.backend.emit.ICodeEmitter;
import org.pseudoforge.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that every target renders a counting loop with an inclusive upper bound.
 * Each row is one target and one loop form; the expected header visits the same values in every target.
 */
public class ForLoopBoundsTest {

    private static final EmitterRegistry REGISTRY = EmitterRegistry.initializeWithDefaults(4);

    @ParameterizedTest(name = "{0}: {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "python     | FOR i FROM 1 TO 3                    | for i in range(1, 4):",
            "python     | FOR i = 0 TO 10 STEP 2               | for i in range(0, 11, 2):",
            "python     | FOR i = 10 TO 1 STEP -3              | for i in range(10, 0, -3):",
            "python     | FOR i = 1 TO 9223372036854775807     | for i in range(1, 9223372036854775808):",
            "javascript | FOR i FROM 1 TO 3                    | for (let i = 1; i <= 3; i++) {",
            "javascript | FOR i = 0 TO 10 STEP 2               | for (let i = 0; i <= 10; i += 2) {",
            "javascript | FOR i = 10 TO 1 STEP -3              | for (let i = 10; i >= 1; i -= 3) {",
            "java       | FOR i FROM 1 TO 3                    | for (int i = 1; i <= 3; i++) {",
            "java       | FOR i = 5 TO 1 STEP -1               | for (int i = 5; i >= 1; i--) {",
            "csharp     | FOR i FROM 1 TO 3                    | for (int i = 1; i <= 3; i++)",
            "csharp     | FOR i = 0 TO 10 STEP 2               | for (int i = 0; i <= 10; i += 2)",
            "cpp        | FOR i FROM 1 TO 3                    | for (int i = 1; i <= 3; i++) {",
            "cpp        | FOR i = 10 TO 1 STEP -3              | for (int i = 10; i >= 1; i -= 3) {",
            "go         | FOR i FROM 1 TO 3                    | for i := 1; i <= 3; i++ {",
            "go         | FOR i = 10 TO 1 STEP -3              | for i := 10; i >= 1; i -= 3 {",
            "rust       | FOR i FROM 1 TO 3                    | for i in 1..=3 {",
            "rust       | FOR i = 0 TO 10 STEP 2               | for i in (0..=10).step_by(2) {",
            "rust       | FOR i = 10 TO 1 STEP -3              | for i in (1..=10).rev().step_by(3) {",
            "rust       | FOR i = 1 TO n STEP k                | for i in (1..=n).step_by(k as usize) {",
            "pseudocode | FOR i FROM 1 TO 3                    | FOR i = 1 TO 3",
            "pseudocode | FOR i = 10 TO 1 STEP -3              | FOR i = 10 TO 1 STEP -3"
    })
    void testLoopHeader(String target, String forLine, String expectedHeader) {
        // Arrange
        ICodeEmitter emitter = REGISTRY.get(TargetLanguage.fromId(target).orElseThrow()).orElseThrow();

        // Act
        String code = emitter.emit(Parser.parse(forLine + "\nPRINT i\nNEXT"));

        // Assert
        assertThat(code).contains(expectedHeader);
    }
}
