package org.pseudoforge.compiler.frontend.parser.features.marker;

import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.parser.IStatementHandler;
import org.pseudoforge.compiler.frontend.parser.ParsingContext;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;

/**
 * Keeps comment lines verbatim, including their marker.
 */
public class CommentStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Line line = context.advance();
        return new CommentNode(line.content(), line.lineNumber());
    }
}
