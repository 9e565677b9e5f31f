package com.jpexs.flowchart.structure;

import java.util.Objects;

/**
 * Open connection point of the flow: the node the next emitted node connects
 * from, and optionally the label the connecting edge must carry.
 *
 * @author JPEXS
 */
public final class FlowPoint {

    private final int nodeId;
    private final String forcedLabel;

    private FlowPoint(int nodeId, String forcedLabel) {
        this.nodeId = nodeId;
        this.forcedLabel = forcedLabel;
    }

    /**
     * Creates a point without forced label.
     *
     * @param nodeId the node id
     * @return the point
     */
    public static FlowPoint of(int nodeId) {
        return new FlowPoint(nodeId, null);
    }

    /**
     * Creates a point whose outgoing edge is labeled.
     *
     * @param nodeId the node id
     * @param forcedLabel label like "True"
     * @return the point
     */
    public static FlowPoint of(int nodeId, String forcedLabel) {
        return new FlowPoint(nodeId, forcedLabel);
    }

    public int getNodeId() {
        return nodeId;
    }

    /**
     * Gets the forced label.
     *
     * @return the label, or null
     */
    public String getForcedLabel() {
        return forcedLabel;
    }

    public boolean hasForcedLabel() {
        return forcedLabel != null && !forcedLabel.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowPoint that = (FlowPoint) o;
        return nodeId == that.nodeId && Objects.equals(forcedLabel, that.forcedLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, forcedLabel);
    }

    @Override
    public String toString() {
        return hasForcedLabel() ? "(n" + nodeId + ", " + forcedLabel + ")" : "n" + nodeId;
    }
}
