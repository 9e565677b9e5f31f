package com.jpexs.flowchart;

import java.util.Objects;

/**
 * Node of the flowchart graph. Immutable once created.
 *
 * @author JPEXS
 */
public class Node {

    private final int id;
    private final String label;
    private final NodeKind kind;
    private final String fillColor;

    /**
     * Creates a new node.
     *
     * @param id the id, unique within one graph
     * @param label the text displayed in the node
     * @param kind the node kind
     * @param fillColor the resolved fill colour
     */
    public Node(int id, String label, NodeKind kind, String fillColor) {
        this.id = id;
        this.label = Objects.requireNonNull(label, "label");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fillColor = Objects.requireNonNull(fillColor, "fillColor");
    }

    public int getId() {
        return id;
    }

    /**
     * Gets the identifier used for this node in DOT output.
     *
     * @return identifier like "n3"
     */
    public String getName() {
        return "n" + id;
    }

    public String getLabel() {
        return label;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getShape() {
        return kind.getShape();
    }

    public String getFillColor() {
        return fillColor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id == node.id
                && label.equals(node.label)
                && kind == node.kind
                && fillColor.equals(node.fillColor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, kind, fillColor);
    }

    @Override
    public String toString() {
        return getName() + "(" + label + ")";
    }
}
