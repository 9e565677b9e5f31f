package com.jpexs.flowchart;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Options of one flowchart build: title, layout direction and style map.
 *
 * @author JPEXS
 */
public final class FlowchartOptions {

    public static final String DEFAULT_TITLE = "Flowchart";

    private static final FlowchartOptions DEFAULTS = builder().build();

    private final String title;
    private final LayoutDirection direction;
    private final ImmutableMap<String, String> styleMap;

    private FlowchartOptions(Builder builder) {
        this.title = builder.title;
        this.direction = builder.direction;
        this.styleMap = builder.styleMap;
    }

    public static FlowchartOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTitle() {
        return title;
    }

    public LayoutDirection getDirection() {
        return direction;
    }

    /**
     * Gets the user supplied style map. Empty means defaults only.
     *
     * @return the style map
     */
    public ImmutableMap<String, String> getStyleMap() {
        return styleMap;
    }

    /**
     * Creates the resolver for the style map of these options.
     *
     * @return the resolver
     */
    public StyleResolver newStyleResolver() {
        if (styleMap.isEmpty()) {
            return StyleResolver.getDefault();
        }
        return new StyleResolver(styleMap);
    }

    public Builder toBuilder() {
        return builder().setTitle(title).setDirection(direction).setStyleMap(styleMap);
    }

    @Override
    public String toString() {
        return "FlowchartOptions{title=" + title + ", direction=" + direction + ", styleMap=" + styleMap + "}";
    }

    /**
     * Builder of {@link FlowchartOptions}.
     */
    public static final class Builder {

        private String title = DEFAULT_TITLE;
        private LayoutDirection direction = LayoutDirection.TOP_TO_BOTTOM;
        private ImmutableMap<String, String> styleMap = ImmutableMap.of();

        private Builder() {
        }

        public Builder setTitle(String title) {
            this.title = checkNotNull(title, "title");
            return this;
        }

        public Builder setDirection(LayoutDirection direction) {
            this.direction = checkNotNull(direction, "direction");
            return this;
        }

        public Builder setStyleMap(Map<String, String> styleMap) {
            this.styleMap = ImmutableMap.copyOf(checkNotNull(styleMap, "styleMap"));
            return this;
        }

        public Builder setTheme(Theme theme) {
            return setStyleMap(checkNotNull(theme, "theme").getColors());
        }

        public FlowchartOptions build() {
            return new FlowchartOptions(this);
        }
    }
}
