package org.pseudoforge.compiler.backend.flowchart;

import org.pseudoforge.compiler.frontend.parser.ParseResult;
import org.pseudoforge.compiler.frontend.parser.ast.AssignmentNode;
import org.pseudoforge.compiler.frontend.parser.ast.CommentNode;
import org.pseudoforge.compiler.frontend.parser.ast.EndNode;
import org.pseudoforge.compiler.frontend.parser.ast.ForNode;
import org.pseudoforge.compiler.frontend.parser.ast.IfNode;
import org.pseudoforge.compiler.frontend.parser.ast.InputNode;
import org.pseudoforge.compiler.frontend.parser.ast.OutputNode;
import org.pseudoforge.compiler.frontend.parser.ast.StartNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementNode;
import org.pseudoforge.compiler.frontend.parser.ast.StatementVisitor;
import org.pseudoforge.compiler.frontend.parser.ast.WhileNode;

import java.util.List;

/**
 * Draws the statement tree as a Mermaid flowchart.
 * <p>
 * Statements chain top to bottom. An IF fans out into {@code yes}/{@code no} branches that
 * always meet again in a merge node, even when a branch is empty. WHILE and FOR loops have a
 * back-edge from the end of the body to the condition and leave through a continuation node.
 * Comments are not drawn.
 */
public class FlowchartEmitter {

    private final int maxLabelLength;

    /**
     * @param maxLabelLength The longest label drawn before it is cut.
     */
    public FlowchartEmitter(int maxLabelLength) {
        this.maxLabelLength = maxLabelLength;
    }

    /**
     * Draws the program.
     * @param program The parsed program.
     * @return The Mermaid text.
     */
    public String emit(ParseResult program) {
        FlowchartGraph graph = new FlowchartGraph(maxLabelLength);
        Walker walker = new Walker(graph);
        List<StatementNode> top = program.statements();
        if (top.stream().noneMatch(StartNode.class::isInstance)) {
            walker.connect(graph.node(NodeShape.TERMINAL, "Start"));
        }
        walker.walk(top);
        if (top.stream().noneMatch(EndNode.class::isInstance)) {
            walker.connect(graph.node(NodeShape.TERMINAL, "End"));
        }
        return graph.render();
    }

    private static final class Walker implements StatementVisitor<Void> {
        private final FlowchartGraph graph;
        private int tail;
        private String pendingLabel;

        private Walker(FlowchartGraph graph) {
            this.graph = graph;
        }

        void walk(List<StatementNode> statements) {
            for (StatementNode statement : statements) {
                statement.accept(this);
            }
        }

        void connect(int id) {
            if (tail != 0) {
                graph.edge(tail, id, pendingLabel);
            }
            pendingLabel = null;
            tail = id;
        }

        /** Walks one branch leaving a decision node; {@link #tail} is its open end afterwards. */
        private void branch(int decision, String label, List<StatementNode> body) {
            tail = decision;
            pendingLabel = label;
            walk(body);
        }

        @Override
        public Void visitStart(StartNode node) {
            connect(graph.node(NodeShape.TERMINAL, "Start"));
            return null;
        }

        @Override
        public Void visitEnd(EndNode node) {
            connect(graph.node(NodeShape.TERMINAL, "End"));
            return null;
        }

        @Override
        public Void visitComment(CommentNode node) {
            return null;
        }

        @Override
        public Void visitInput(InputNode node) {
            connect(graph.node(NodeShape.DATA, "Input: " + node.targetVariable()));
            return null;
        }

        @Override
        public Void visitOutput(OutputNode node) {
            connect(graph.node(NodeShape.DATA, "Output: " + node.message()));
            return null;
        }

        @Override
        public Void visitAssignment(AssignmentNode node) {
            connect(graph.node(NodeShape.PROCESS, node.targetVariable() + " = " + node.valueExpression()));
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            int decision = graph.node(NodeShape.DECISION, conditionLabel(node.conditionExpression()) + "?");
            connect(decision);

            branch(decision, "yes", node.thenBody());
            int thenTail = tail;
            String thenLabel = pendingLabel;

            branch(decision, "no", node.elseBody());
            int elseTail = tail;
            String elseLabel = pendingLabel;

            int merge = graph.node(NodeShape.JUNCTION, " ");
            graph.edge(thenTail, merge, thenLabel);
            graph.edge(elseTail, merge, elseLabel);
            tail = merge;
            pendingLabel = null;
            return null;
        }

        @Override
        public Void visitWhile(WhileNode node) {
            loop("While " + conditionLabel(node.conditionExpression()) + "?", "yes", "no", node.body());
            return null;
        }

        @Override
        public Void visitFor(ForNode node) {
            String label = "For " + node.loopVariable() + " = " + node.startExpr() + " to " + node.endExpr();
            if (!"1".equals(node.stepExpr())) {
                label += " step " + node.stepExpr();
            }
            loop(label, "iterate", "exit", node.body());
            return null;
        }

        private void loop(String label, String enter, String leave, List<StatementNode> body) {
            int decision = graph.node(NodeShape.DECISION, label);
            connect(decision);
            branch(decision, enter, body);
            graph.edge(tail, decision, pendingLabel);
            int continuation = graph.node(NodeShape.JUNCTION, " ");
            graph.edge(decision, continuation, leave);
            tail = continuation;
            pendingLabel = null;
        }

        private static String conditionLabel(String condition) {
            return condition == null || condition.isBlank() ? "condition" : condition;
        }
    }
}
