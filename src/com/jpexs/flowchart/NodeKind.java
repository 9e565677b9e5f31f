package com.jpexs.flowchart;

/**
 * Kind of a flowchart node. The kind determines the shape of the node and,
 * through {@link StyleResolver}, its default fill colour.
 *
 * @author JPEXS
 */
public enum NodeKind {
    /**
     * Entry of a function.
     */
    START("oval"),
    /**
     * Branch point of an if statement or of a try statement.
     */
    DECISION("diamond"),
    /**
     * Condition of a for or while loop, target of the loop back-edge.
     */
    LOOP_CONDITION("diamond"),
    /**
     * Return or raise, ends its path.
     */
    TERMINAL("box"),
    /**
     * Any other statement.
     */
    STEP("box"),
    /**
     * Break or continue, connected later by the enclosing loop.
     */
    DEAD_END_JUMP("box"),
    /**
     * Placeholder shown instead of a graph that could not be built.
     */
    ERROR("box");

    private final String shape;

    private NodeKind(String shape) {
        this.shape = shape;
    }

    /**
     * Gets the Graphviz shape name of this kind.
     *
     * @return the shape name
     */
    public String getShape() {
        return shape;
    }
}
