package com.jpexs.flowchart.structure;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered set of open flow points where execution currently stands.
 * Immutable; every traversal step returns a new frontier.
 *
 * @author JPEXS
 */
public final class Frontier implements Iterable<FlowPoint> {

    private static final Frontier EMPTY = new Frontier(ImmutableList.<FlowPoint>of());

    private final ImmutableList<FlowPoint> points;

    private Frontier(ImmutableList<FlowPoint> points) {
        this.points = points;
    }

    /**
     * Gets the frontier of a terminated path.
     *
     * @return empty frontier
     */
    public static Frontier empty() {
        return EMPTY;
    }

    public static Frontier of(FlowPoint point) {
        return new Frontier(ImmutableList.of(point));
    }

    /**
     * Creates a frontier with a single unlabeled point.
     *
     * @param nodeId the node id
     * @return the frontier
     */
    public static Frontier of(int nodeId) {
        return of(FlowPoint.of(nodeId));
    }

    /**
     * Creates a frontier with a single labeled point.
     *
     * @param nodeId the node id
     * @param forcedLabel the label of the next edge from the node
     * @return the frontier
     */
    public static Frontier of(int nodeId, String forcedLabel) {
        return of(FlowPoint.of(nodeId, forcedLabel));
    }

    public static Frontier of(List<FlowPoint> points) {
        return points.isEmpty() ? EMPTY : new Frontier(ImmutableList.copyOf(points));
    }

    /**
     * Concatenates two frontiers, keeping the order.
     *
     * @param other points to append
     * @return the combined frontier
     */
    public Frontier concat(Frontier other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new Frontier(ImmutableList.<FlowPoint>builder().addAll(points).addAll(other.points).build());
    }

    public ImmutableList<FlowPoint> getPoints() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    @Override
    public Iterator<FlowPoint> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return points.equals(((Frontier) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return points.toString();
    }
}
