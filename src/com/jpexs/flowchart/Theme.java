package com.jpexs.flowchart;

import com.google.common.collect.ImmutableMap;

/**
 * Named colour themes. Each theme maps the shape names and the jump
 * categories ("break", "continue") to fill colours.
 *
 * @author JPEXS
 */
public enum Theme {
    CLASSIC("Classic (Pastel)", ImmutableMap.<String, String>builder()
            .put("box", "lightyellow")
            .put("diamond", "lightblue")
            .put("oval", "lightgreen")
            .put("circle", "thistle")
            .put("parallelogram", "lightcyan")
            .put("break", "mistyrose")
            .put("continue", "lightgray")
            .build()),
    CLEAN_WHITE("Clean White", ImmutableMap.<String, String>builder()
            .put("box", "white")
            .put("diamond", "white")
            .put("oval", "white")
            .put("circle", "white")
            .put("parallelogram", "white")
            .put("break", "white")
            .put("continue", "white")
            .build()),
    DARK_MODE("Dark Mode", ImmutableMap.<String, String>builder()
            .put("box", "#444444")
            .put("diamond", "#555555")
            .put("oval", "#222222")
            .put("circle", "#666666")
            .put("parallelogram", "#333333")
            .put("break", "#883333")
            .put("continue", "#333388")
            .build()),
    BLUEBERRY("Blueberry", ImmutableMap.<String, String>builder()
            .put("box", "#e3f2fd")
            .put("diamond", "#bbdefb")
            .put("oval", "#90caf9")
            .put("circle", "#64b5f6")
            .put("parallelogram", "#42a5f5")
            .put("break", "#ffcdd2")
            .put("continue", "#e1bee7")
            .build());

    private final String displayName;
    private final ImmutableMap<String, String> colors;

    private Theme(String displayName, ImmutableMap<String, String> colors) {
        this.displayName = displayName;
        this.colors = colors;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Gets the style map of this theme.
     *
     * @return map from shape name or category to colour
     */
    public ImmutableMap<String, String> getColors() {
        return colors;
    }

    /**
     * Finds a theme by display name ("Dark Mode") or enum name ("DARK_MODE"),
     * ignoring case.
     *
     * @param name the name
     * @return the theme
     * @throws IllegalArgumentException when no theme matches
     */
    public static Theme fromName(String name) {
        for (Theme theme : values()) {
            if (theme.displayName.equalsIgnoreCase(name) || theme.name().equalsIgnoreCase(name)) {
                return theme;
            }
        }
        throw new IllegalArgumentException("Unknown theme: " + name);
    }
}
