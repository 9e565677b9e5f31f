package com.jpexs.flowchart;

import static com.google.common.base.Preconditions.checkNotNull;

import com.jpexs.flowchart.statement.AssignmentStatement;
import com.jpexs.flowchart.statement.BreakStatement;
import com.jpexs.flowchart.statement.ContinueStatement;
import com.jpexs.flowchart.statement.ExpressionStatement;
import com.jpexs.flowchart.statement.FunctionStatement;
import com.jpexs.flowchart.statement.IfStatement;
import com.jpexs.flowchart.statement.LoopStatement;
import com.jpexs.flowchart.statement.Module;
import com.jpexs.flowchart.statement.PassStatement;
import com.jpexs.flowchart.statement.RaiseStatement;
import com.jpexs.flowchart.statement.ReturnStatement;
import com.jpexs.flowchart.statement.Statement;
import com.jpexs.flowchart.statement.TryStatement;
import com.jpexs.flowchart.structure.FlowPoint;
import com.jpexs.flowchart.structure.Frontier;
import com.jpexs.flowchart.structure.LoopContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a flowchart graph from a statement tree.
 * <p>
 * The tree is walked once, depth first, in source order. Every statement
 * receives the frontier (the open flow points before it) and returns the
 * frontier after it:
 * - plain statements emit one node connected from every open point,
 * - if statements fan out into "True" and "False" paths whose ends stay open
 * side by side, so the next node merges them,
 * - loops get a single back-edge per open body end, breaks leave the loop
 * together with the "False" edge, continues go back to the condition,
 * - try statements fan out into the "Attempt" path and one path per handler,
 * all of them flowing into the finally block.
 * <p>
 * An instance can be reused; each build starts from a clean state. Instances
 * are not thread safe.
 *
 * @author JPEXS
 */
public class FlowchartBuilder {

    private static final Logger LOGGER = Logger.getLogger(FlowchartBuilder.class.getName());

    public static final String EMPTY_TREE_LABEL = "Error: empty statement tree";

    public static final String TRUE_LABEL = "True";
    public static final String FALSE_LABEL = "False";
    public static final String ATTEMPT_LABEL = "Attempt";

    private final FlowchartOptions options;
    private final StyleResolver styleResolver;

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Deque<LoopContext> loopStack = new ArrayDeque<>();
    private int nextId = 0;
    private Frontier lastFrontier = Frontier.empty();

    /**
     * Creates a builder with default options.
     */
    public FlowchartBuilder() {
        this(FlowchartOptions.defaults());
    }

    /**
     * Creates a builder.
     *
     * @param options title, layout direction and style map of the built graphs
     */
    public FlowchartBuilder(FlowchartOptions options) {
        this.options = checkNotNull(options, "options");
        this.styleResolver = options.newStyleResolver();
    }

    /**
     * Builds the flowchart of a statement tree.
     * A null or empty tree produces a graph with a single error node.
     *
     * @param tree the statement tree
     * @return the graph
     */
    public GraphDescription build(Module tree) {
        reset();

        if (tree == null || tree.isEmpty()) {
            LOGGER.log(Level.WARNING, "Cannot build flowchart \"{0}\": empty statement tree", options.getTitle());
            emit(EMPTY_TREE_LABEL, NodeKind.ERROR, StyleResolver.ERROR_CATEGORY, Frontier.empty());
            lastFrontier = Frontier.empty();
        } else {
            lastFrontier = visitBody(tree.getBody(), Frontier.empty());
        }

        GraphDescription graph = new GraphDescription(options.getTitle(), options.getDirection(), nodes, edges);
        LOGGER.log(Level.FINE, "Built flowchart \"{0}\": {1} nodes, {2} edges",
                new Object[]{options.getTitle(), nodes.size(), edges.size()});
        return graph;
    }

    /**
     * Builds a graph holding only an error node. Used when there is no tree to
     * build from, for example because the source text could not be parsed.
     *
     * @param message the text of the error node
     * @param options title and layout direction of the graph
     * @return the graph
     */
    public static GraphDescription errorGraph(String message, FlowchartOptions options) {
        String fillColor = options.newStyleResolver().resolve(StyleResolver.ERROR_CATEGORY, NodeKind.ERROR.getShape());
        Node node = new Node(0, message, NodeKind.ERROR, fillColor);
        List<Node> nodes = new ArrayList<>();
        nodes.add(node);
        return new GraphDescription(options.getTitle(), options.getDirection(), nodes, new ArrayList<Edge>());
    }

    /**
     * Gets the frontier that was left open after the last statement of the
     * last build. Empty when the flow ended with return, raise, break or continue.
     *
     * @return the frontier
     */
    public Frontier getLastFrontier() {
        return lastFrontier;
    }

    private void reset() {
        nodes.clear();
        edges.clear();
        loopStack.clear();
        nextId = 0;
        lastFrontier = Frontier.empty();
    }

    /**
     * Creates a node and connects it from every point of connectFrom.
     *
     * @param label node text
     * @param kind node kind
     * @param category style category, or null
     * @param connectFrom points to connect from
     * @return the new node
     */
    private Node emit(String label, NodeKind kind, String category, Frontier connectFrom) {
        return emit(label, kind, category, connectFrom, null);
    }

    /**
     * Creates a node and connects it from every point of connectFrom.
     * The edge from a point is labeled with the forced label of the point, or
     * with defaultEdgeLabel if the point has none.
     *
     * @param label node text
     * @param kind node kind
     * @param category style category, or null
     * @param connectFrom points to connect from
     * @param defaultEdgeLabel label of edges from points without forced label, or null
     * @return the new node, the frontier after it is just this node
     */
    private Node emit(String label, NodeKind kind, String category, Frontier connectFrom, String defaultEdgeLabel) {
        String fillColor = styleResolver.resolve(category, kind.getShape());
        Node node = new Node(nextId++, label, kind, fillColor);
        nodes.add(node);

        for (FlowPoint point : connectFrom) {
            String edgeLabel = point.hasForcedLabel() ? point.getForcedLabel() : defaultEdgeLabel;
            edges.add(new Edge(point.getNodeId(), node.getId(), edgeLabel));
        }
        return node;
    }

    private Frontier visitBody(List<Statement> body, Frontier frontier) {
        for (Statement stmt : body) {
            frontier = visit(stmt, frontier);
        }
        return frontier;
    }

    private Frontier visit(Statement stmt, Frontier frontier) {
        if (stmt instanceof FunctionStatement) {
            return visitFunction((FunctionStatement) stmt, frontier);
        } else if (stmt instanceof IfStatement) {
            return visitIf((IfStatement) stmt, frontier);
        } else if (stmt instanceof LoopStatement) {
            return visitLoop((LoopStatement) stmt, frontier);
        } else if (stmt instanceof TryStatement) {
            return visitTry((TryStatement) stmt, frontier);
        } else if (stmt instanceof BreakStatement) {
            return visitBreak(frontier);
        } else if (stmt instanceof ContinueStatement) {
            return visitContinue(frontier);
        } else if (stmt instanceof ReturnStatement) {
            ReturnStatement ret = (ReturnStatement) stmt;
            emit("Return: " + (ret.hasValue() ? ret.getValue().trim() : "None"), NodeKind.TERMINAL, null, frontier);
            return Frontier.empty();
        } else if (stmt instanceof RaiseStatement) {
            RaiseStatement raise = (RaiseStatement) stmt;
            emit(raise.hasException() ? "Raise: " + raise.getException().trim() : "Raise", NodeKind.TERMINAL, null, frontier);
            return Frontier.empty();
        } else if (stmt instanceof PassStatement) {
            return frontier;
        } else if (stmt instanceof ExpressionStatement) {
            ExpressionStatement expr = (ExpressionStatement) stmt;
            if (expr.isDocString()) {
                return frontier;
            }
            return Frontier.of(emit(expr.getExpression().trim(), NodeKind.STEP, null, frontier).getId());
        } else if (stmt instanceof AssignmentStatement) {
            AssignmentStatement assign = (AssignmentStatement) stmt;
            return Frontier.of(emit(assign.getSource().trim(), NodeKind.STEP, null, frontier).getId());
        }
        return Frontier.of(emit(stmt.getKindName(), NodeKind.STEP, null, frontier).getId());
    }

    private Frontier visitFunction(FunctionStatement function, Frontier frontier) {
        Node start = emit("Function: " + function.getName(), NodeKind.START, null, Frontier.empty());
        Frontier end = visitBody(function.getBody(), Frontier.of(start.getId()));
        LOGGER.log(Level.FINER, "Function {0} ends with {1} open points", new Object[]{function.getName(), end.size()});
        // the definition does not run its body, the enclosing flow continues as before
        return frontier;
    }

    private Frontier visitIf(IfStatement ifStmt, Frontier frontier) {
        Node decision = emit("If: " + ifStmt.getCondition().trim(), NodeKind.DECISION, null, frontier);

        Frontier trueEnd = visitBody(ifStmt.getOnTrue(), Frontier.of(decision.getId(), TRUE_LABEL));
        Frontier falseEnd = visitBody(ifStmt.getOnFalse(), Frontier.of(decision.getId(), FALSE_LABEL));

        return trueEnd.concat(falseEnd);
    }

    private Frontier visitLoop(LoopStatement loop, Frontier frontier) {
        Node condition = emit(loop.getHeader().trim(), NodeKind.LOOP_CONDITION, null, frontier);

        LoopContext context = new LoopContext(condition);
        loopStack.push(context);
        Frontier bodyEnd = visitBody(loop.getBody(), Frontier.of(condition.getId(), TRUE_LABEL));

        // back-edges of paths that fell through the body
        for (FlowPoint point : bodyEnd) {
            edges.add(new Edge(point.getNodeId(), condition.getId(), point.getForcedLabel()));
        }

        loopStack.pop();
        for (Node cont : context.continues) {
            edges.add(new Edge(cont.getId(), condition.getId()));
        }

        Frontier exit = visitBody(loop.getOrElse(), Frontier.of(condition.getId(), FALSE_LABEL));
        for (Node brk : context.breaks) {
            exit = exit.concat(Frontier.of(brk.getId()));
        }
        return exit;
    }

    private Frontier visitBreak(Frontier frontier) {
        LoopContext context = loopStack.peek();
        if (context == null) {
            LOGGER.warning("break outside of loop");
            emit("break (orphaned)", NodeKind.DEAD_END_JUMP, "break", frontier);
        } else {
            context.breaks.add(emit("break", NodeKind.DEAD_END_JUMP, "break", frontier));
        }
        return Frontier.empty();
    }

    private Frontier visitContinue(Frontier frontier) {
        LoopContext context = loopStack.peek();
        if (context == null) {
            LOGGER.warning("continue outside of loop");
            emit("continue (orphaned)", NodeKind.DEAD_END_JUMP, "continue", frontier);
        } else {
            context.continues.add(emit("continue", NodeKind.DEAD_END_JUMP, "continue", frontier));
        }
        return Frontier.empty();
    }

    private Frontier visitTry(TryStatement tryStmt, Frontier frontier) {
        Node tryNode = emit("Try", NodeKind.DECISION, null, frontier);

        Frontier successEnd = visitBody(tryStmt.getTryBody(), Frontier.of(tryNode.getId(), ATTEMPT_LABEL));

        Frontier allEnds = Frontier.empty();
        for (TryStatement.ExceptHandler handler : tryStmt.getHandlers()) {
            allEnds = allEnds.concat(visitBody(handler.getBody(), Frontier.of(tryNode.getId(), handler.getEdgeLabel())));
        }

        if (tryStmt.hasElse()) {
            allEnds = allEnds.concat(visitBody(tryStmt.getOrElse(), successEnd));
        } else {
            allEnds = allEnds.concat(successEnd);
        }

        // handlers, else and plain success all flow into finally
        return visitBody(tryStmt.getFinallyBody(), allEnds);
    }
}
