package com.jpexs.flowchart;

import java.util.Objects;

/**
 * Directed edge from one node to another, with an optional label.
 *
 * @author JPEXS
 */
public class Edge {

    private final int from;
    private final int to;
    private final String label;

    /**
     * Creates an unlabeled edge.
     *
     * @param from source node id
     * @param to target node id
     */
    public Edge(int from, int to) {
        this(from, to, null);
    }

    /**
     * Creates an edge.
     *
     * @param from source node id
     * @param to target node id
     * @param label edge label like "True", or null for plain sequencing
     */
    public Edge(int from, int to, String label) {
        this.from = from;
        this.to = to;
        this.label = label;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    /**
     * Gets the label.
     *
     * @return the label, or null if unlabeled
     */
    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return from == edge.from && to == edge.to && Objects.equals(label, edge.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, label);
    }

    @Override
    public String toString() {
        if (hasLabel()) {
            return "n" + from + " -> n" + to + " [" + label + "]";
        }
        return "n" + from + " -> n" + to;
    }
}
