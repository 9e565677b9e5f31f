package com.jpexs.flowchart;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a flowchart build: ordered nodes and edges plus title and layout
 * direction. This is everything a renderer needs.
 *
 * @author JPEXS
 */
public final class GraphDescription {

    private final String title;
    private final LayoutDirection direction;
    private final ImmutableList<Node> nodes;
    private final ImmutableList<Edge> edges;

    public GraphDescription(String title, LayoutDirection direction, List<Node> nodes, List<Edge> edges) {
        this.title = checkNotNull(title, "title");
        this.direction = checkNotNull(direction, "direction");
        this.nodes = ImmutableList.copyOf(nodes);
        this.edges = ImmutableList.copyOf(edges);
    }

    public String getTitle() {
        return title;
    }

    public LayoutDirection getDirection() {
        return direction;
    }

    public ImmutableList<Node> getNodes() {
        return nodes;
    }

    public ImmutableList<Edge> getEdges() {
        return edges;
    }

    /**
     * Gets node by its id.
     *
     * @param id the id
     * @return the node, or null when there is no such node
     */
    public Node getNode(int id) {
        for (Node node : nodes) {
            if (node.getId() == id) {
                return node;
            }
        }
        return null;
    }

    /**
     * Gets the first node with the given label.
     *
     * @param label the label
     * @return the node, or null when not found
     */
    public Node findNode(String label) {
        for (Node node : nodes) {
            if (node.getLabel().equals(label)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Gets edges entering a node, in emission order.
     *
     * @param node the target node
     * @return inbound edges
     */
    public List<Edge> getInEdges(Node node) {
        List<Edge> ret = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getTo() == node.getId()) {
                ret.add(edge);
            }
        }
        return ret;
    }

    /**
     * Gets edges leaving a node, in emission order.
     *
     * @param node the source node
     * @return outbound edges
     */
    public List<Edge> getOutEdges(Node node) {
        List<Edge> ret = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getFrom() == node.getId()) {
                ret.add(edge);
            }
        }
        return ret;
    }

    /**
     * Generates the Graphviz/DOT representation of this graph.
     *
     * @return DOT source
     */
    public String toDot() {
        return DotDialect.INSTANCE.toDot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphDescription that = (GraphDescription) o;
        return title.equals(that.title)
                && direction == that.direction
                && nodes.equals(that.nodes)
                && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, direction, nodes, edges);
    }

    @Override
    public String toString() {
        return "Graph{title=" + title + ", nodes=" + nodes + ", edges=" + edges + "}";
    }
}
