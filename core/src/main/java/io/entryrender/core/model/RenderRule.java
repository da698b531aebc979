package io.entryrender.core.model;

import java.util.Objects;

/**
 * One display rule of a profile: how nodes of one element type are ordered, wrapped, decorated
 * and filtered. A profile may carry several rules for the same type, distinguished by their
 * filters.
 *
 * <p>
 * Immutable, thread-safe. A rule list can be shared by concurrent render calls.
 *
 * @param nodeType       the element name the rule applies to (e.g. {@code "relation"})
 * @param order          display order among siblings, ascending
 * @param cssClass       class attribute of the wrapper element (may be empty)
 * @param prefix         decoration emitted before the content, empty for none
 * @param suffix         decoration emitted after the content, empty for none
 * @param visibility     visibility policy
 * @param mode           inline ({@code span}) or block ({@code div}) wrapper
 * @param filter         parsed filter, or {@code null} for "matches every node of the type"
 * @param separator      separator between items of a grouped rule
 * @param forcedLanguage language imposed on descendants, {@code "*"} for all, or {@code null} to
 *                       inherit
 * @param aspect         how range-backed values are shown, or {@code null} for the stored value
 */
public record RenderRule(
        String nodeType,
        int order,
        String cssClass,
        String prefix,
        String suffix,
        Visibility visibility,
        DisplayMode mode,
        RuleFilter filter,
        String separator,
        String forcedLanguage,
        DisplayAspect aspect) {

    /** Default separator between grouped items. */
    public static final String DEFAULT_SEPARATOR = ", ";

    /** Canonical constructor. Validates required fields and applies defaults. */
    public RenderRule {
        Objects.requireNonNull(nodeType, "nodeType must not be null");
        if (nodeType.isBlank()) {
            throw new IllegalArgumentException("nodeType must not be blank");
        }
        cssClass = cssClass != null ? cssClass.trim() : "";
        prefix = prefix != null ? prefix : "";
        suffix = suffix != null ? suffix : "";
        visibility = visibility != null ? visibility : Visibility.IF_CONTENT;
        mode = mode != null ? mode : DisplayMode.INLINE;
        separator = separator != null ? separator : DEFAULT_SEPARATOR;
        forcedLanguage = forcedLanguage != null && !forcedLanguage.isBlank() ? forcedLanguage.trim() : null;
    }

    /** Returns {@code true} if the rule carries a non-empty filter. */
    public boolean hasFilter() {
        return filter != null;
    }

    /** Tests whether the node passes this rule's filter (always true without a filter). */
    public boolean accepts(SourceNode node) {
        return filter == null || filter.matches(node.filterKey());
    }

    /** Creates a builder for a rule on the given element type. */
    public static Builder builder(String nodeType) {
        return new Builder(nodeType);
    }

    /** Builder for {@link RenderRule}. Unset fields take the canonical defaults. */
    public static final class Builder {

        private final String nodeType;
        private int order;
        private String cssClass;
        private String prefix;
        private String suffix;
        private Visibility visibility;
        private DisplayMode mode;
        private RuleFilter filter;
        private String separator;
        private String forcedLanguage;
        private DisplayAspect aspect;

        private Builder(String nodeType) {
            this.nodeType = nodeType;
            this.cssClass = nodeType;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder cssClass(String cssClass) {
            this.cssClass = cssClass;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = suffix;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder mode(DisplayMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder block() {
            return mode(DisplayMode.BLOCK);
        }

        public Builder filter(String expression) {
            this.filter = RuleFilter.parse(expression);
            return this;
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder forcedLanguage(String forcedLanguage) {
            this.forcedLanguage = forcedLanguage;
            return this;
        }

        public Builder aspect(DisplayAspect aspect) {
            this.aspect = aspect;
            return this;
        }

        public RenderRule build() {
            return new RenderRule(
                    nodeType,
                    order,
                    cssClass,
                    prefix,
                    suffix,
                    visibility,
                    mode,
                    filter,
                    separator,
                    forcedLanguage,
                    aspect);
        }
    }
}
