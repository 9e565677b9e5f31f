package com.jpexs.flowchart;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Resolves the fill colour of a node from its style category and shape.
 * <p>
 * Lookup order: the supplied map by category, the defaults by category, the
 * supplied map by shape, the defaults by shape, and finally
 * {@link #FALLBACK_COLOR}. A category colour always wins over a shape colour,
 * so error nodes stay {@code lightpink} under every theme.
 *
 * @author JPEXS
 */
public class StyleResolver {

    public static final String FALLBACK_COLOR = "white";

    /**
     * Category of error placeholder nodes.
     */
    public static final String ERROR_CATEGORY = "error";

    /**
     * Classic theme plus the colour of error nodes.
     */
    public static final ImmutableMap<String, String> DEFAULT_COLORS = ImmutableMap.<String, String>builder()
            .putAll(Theme.CLASSIC.getColors())
            .put(ERROR_CATEGORY, "lightpink")
            .build();

    private static final StyleResolver DEFAULT = new StyleResolver(ImmutableMap.<String, String>of());

    private final ImmutableMap<String, String> styleMap;
    private final ImmutableMap<String, String> defaults;

    /**
     * Creates a resolver over the given map with {@link #DEFAULT_COLORS} as defaults.
     *
     * @param styleMap map from category or shape name to colour
     */
    public StyleResolver(Map<String, String> styleMap) {
        this(styleMap, DEFAULT_COLORS);
    }

    /**
     * Creates a resolver.
     *
     * @param styleMap map from category or shape name to colour
     * @param defaults colours used for keys missing in styleMap
     */
    public StyleResolver(Map<String, String> styleMap, Map<String, String> defaults) {
        this.styleMap = ImmutableMap.copyOf(styleMap);
        this.defaults = ImmutableMap.copyOf(defaults);
    }

    public static StyleResolver getDefault() {
        return DEFAULT;
    }

    /**
     * Resolves the fill colour.
     *
     * @param category the style category, may be null
     * @param shape the shape name
     * @return the colour
     */
    public String resolve(String category, String shape) {
        if (category != null) {
            if (styleMap.containsKey(category)) {
                return styleMap.get(category);
            }
            if (defaults.containsKey(category)) {
                return defaults.get(category);
            }
        }
        if (styleMap.containsKey(shape)) {
            return styleMap.get(shape);
        }
        if (defaults.containsKey(shape)) {
            return defaults.get(shape);
        }
        return FALLBACK_COLOR;
    }

    /**
     * Resolves the fill colour of a node kind without a category.
     *
     * @param kind the kind
     * @return the colour
     */
    public String resolve(NodeKind kind) {
        return resolve(null, kind.getShape());
    }
}
