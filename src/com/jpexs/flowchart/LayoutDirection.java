package com.jpexs.flowchart;

/**
 * Direction in which the layout engine ranks the nodes.
 *
 * @author JPEXS
 */
public enum LayoutDirection {
    TOP_TO_BOTTOM("TB"),
    LEFT_TO_RIGHT("LR");

    private final String rankdir;

    private LayoutDirection(String rankdir) {
        this.rankdir = rankdir;
    }

    /**
     * Gets the value of the Graphviz rankdir attribute.
     *
     * @return "TB" or "LR"
     */
    public String getRankdir() {
        return rankdir;
    }

    /**
     * Finds the direction for a rankdir value or enum name, ignoring case.
     *
     * @param value "TB", "LR", "TOP_TO_BOTTOM" or "LEFT_TO_RIGHT"
     * @return the direction
     * @throws IllegalArgumentException when the value is unknown
     */
    public static LayoutDirection fromString(String value) {
        for (LayoutDirection direction : values()) {
            if (direction.rankdir.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown layout direction: " + value);
    }
}
