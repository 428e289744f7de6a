package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.diagnostics.SyntaxDiagnostic;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the parser learned about one pseudocode text. Immutable.
 *
 * @param statements  The top-level statements.
 * @param variables   The bound variables in first-seen order.
 * @param hasInput    Whether any INPUT statement was parsed.
 * @param hasOutput   Whether any OUTPUT statement was parsed.
 * @param diagnostics The issues found, in encounter order.
 */
public record ParseResult(
        List<StatementNode> statements,
        Set<String> variables,
        boolean hasInput,
        boolean hasOutput,
        List<SyntaxDiagnostic> diagnostics
) {
    public ParseResult {
        statements = List.copyOf(statements);
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if there is no top-level statement.
     */
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /**
     * @return {@code true} if parsing reported any issue.
     */
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
