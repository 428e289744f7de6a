package org.pseudoforge.compiler.frontend.parser;

import org.pseudoforge.compiler.diagnostics.DiagnosticKind;
import org.pseudoforge.compiler.diagnostics.DiagnosticsEngine;
import org.pseudoforge.compiler.frontend.lexer.Line;
import org.pseudoforge.compiler.frontend.lexer.LineTokenizer;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The error-tolerant recursive-descent parser for pseudocode. It consumes the {@link Line}s
 * produced by the {@link LineTokenizer} and builds a statement tree.
 * <p>
 * Malformed lines never abort the parse: they are reported to the {@link DiagnosticsEngine}
 * and dropped. One cursor is shared by every nested block, and the terminators of all open
 * blocks are kept on a stack so that an unclosed inner block gives way to its enclosing one.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Line> lines;
    private final DiagnosticsEngine diagnostics;
    private final KeywordTable keywordTable;
    private final StatementHandlerRegistry handlerRegistry;
    private final UsageTracker usageTracker = new UsageTracker();
    private final Deque<List<String>> openBlocks = new ArrayDeque<>();
    private int current = 0;

    /**
     * Constructs a new Parser with the default keyword table.
     * @param lines The lines to parse.
     * @param diagnostics The engine for reporting issues.
     */
    public Parser(List<Line> lines, DiagnosticsEngine diagnostics) {
        this(lines, diagnostics, KeywordTable.defaults());
    }

    /**
     * Constructs a new Parser.
     * @param lines The lines to parse.
     * @param diagnostics The engine for reporting issues.
     * @param keywordTable The table used to classify lines.
     */
    public Parser(List<Line> lines, DiagnosticsEngine diagnostics, KeywordTable keywordTable) {
        this.lines = List.copyOf(lines);
        this.diagnostics = diagnostics;
        this.keywordTable = keywordTable;
        this.handlerRegistry = StatementHandlerRegistry.initialize();
    }

    /**
     * Tokenizes and parses a pseudocode text.
     * @param text The raw pseudocode, may be {@code null}.
     * @return The parse result.
     */
    public static ParseResult parse(String text) {
        return new Parser(new LineTokenizer(text).scanLines(), new DiagnosticsEngine()).parse();
    }

    /**
     * Parses all lines.
     * @return The statement tree with the tracked variables and the diagnostics.
     */
    public ParseResult parse() {
        List<StatementNode> statements = parseBlock(List.of());
        LOG.debug("Parsed {} top-level statements from {} lines with {} diagnostics",
                statements.size(), lines.size(), diagnostics.getDiagnostics().size());
        return new ParseResult(
                statements,
                usageTracker.getVariables(),
                usageTracker.hasInput(),
                usageTracker.hasOutput(),
                diagnostics.getDiagnostics());
    }

    @Override
    public List<StatementNode> parseBlock(List<String> terminators) {
        openBlocks.push(terminators);
        try {
            List<StatementNode> block = new ArrayList<>();
            while (!isAtEnd()) {
                String normalized = KeywordTable.normalize(peek().content());
                if (KeywordTable.matchesAny(normalized, terminators) || closesEnclosingBlock(normalized)) {
                    break;
                }
                if (KeywordTable.isTerminator(normalized)) {
                    Line stray = advance();
                    diagnostics.report(DiagnosticKind.AMBIGUOUS_STRUCTURE,
                            "'" + stray.content() + "' does not close any open block",
                            stray.lineNumber(),
                            "Remove the line or add the IF, WHILE or FOR it is meant to close");
                    continue;
                }
                StatementNode node = statement();
                if (node != null) {
                    block.add(node);
                }
            }
            return block;
        } finally {
            openBlocks.pop();
        }
    }

    private boolean closesEnclosingBlock(String normalized) {
        Iterator<List<String>> it = openBlocks.iterator();
        if (it.hasNext()) {
            it.next(); // the block being parsed
        }
        while (it.hasNext()) {
            if (KeywordTable.matchesAny(normalized, it.next())) {
                return true;
            }
        }
        return false;
    }

    private StatementNode statement() {
        Line line = peek();
        int start = current;
        Optional<StatementKind> kind = keywordTable.classify(line.content());
        if (kind.isEmpty()) {
            advance();
            diagnostics.report(DiagnosticKind.INVALID_SYNTAX,
                    "Unrecognized statement '" + line.content() + "'",
                    line.lineNumber(),
                    "Start the line with a keyword such as INPUT, OUTPUT, SET, IF, WHILE or FOR, or write an assignment such as x = 1");
            return null;
        }
        Optional<IStatementHandler> handler = handlerRegistry.get(kind.get());
        if (handler.isEmpty()) {
            advance();
            diagnostics.report(DiagnosticKind.INVALID_SYNTAX,
                    "No handler for " + kind.get() + " statement '" + line.content() + "'",
                    line.lineNumber(),
                    "Rewrite the line using one of the supported statements");
            return null;
        }
        try {
            return handler.get().parse(this);
        } catch (RuntimeException ex) {
            LOG.debug("Handler for {} failed on line {}", kind.get(), line.lineNumber(), ex);
            if (current == start) {
                advance();
            }
            diagnostics.report(DiagnosticKind.INVALID_SYNTAX,
                    "Could not parse '" + line.content() + "': " + ex.getMessage(),
                    line.lineNumber(),
                    "Simplify the statement or split it across several lines");
            return null;
        }
    }

    @Override
    public boolean check(List<String> keywords) {
        if (isAtEnd()) return false;
        return KeywordTable.matchesAny(KeywordTable.normalize(peek().content()), keywords);
    }

    @Override
    public Line advance() {
        Line line = peek();
        if (!isAtEnd()) current++;
        return line;
    }

    @Override
    public boolean isAtEnd() {
        return current >= lines.size();
    }

    @Override
    public Line peek() {
        if (isAtEnd()) {
            return lines.isEmpty() ? new Line("", 0) : lines.get(lines.size() - 1);
        }
        return lines.get(current);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public UsageTracker getUsageTracker() {
        return usageTracker;
    }
}
