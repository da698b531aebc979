package io.entryrender.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed element of an entry document.
 *
 * <p>
 * Immutable. The {@code index} is assigned once at parse time (document pre-order, root = 0) and
 * identifies the node within its {@link SourceTree}; render state is keyed by it.
 *
 * @param index      arena index within the owning tree
 * @param tag        namespace-stripped element name
 * @param kind       node kind derived from the tag
 * @param attributes namespace-stripped attributes in document order
 * @param children   child elements in document order
 * @param text       whitespace-normalized text: the full text content for {@code text} elements,
 *                   the element's own direct text otherwise; never null
 */
public record SourceNode(
        int index, String tag, NodeKind kind, Map<String, String> attributes, List<SourceNode> children, String text) {

    public SourceNode {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        attributes = attributes != null ? Collections.unmodifiableMap(attributes) : Map.of();
        children = children != null ? Collections.unmodifiableList(children) : List.of();
        text = text != null ? text : "";
    }

    /** Returns the attribute value, or {@code null} if absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /** Returns the attribute value if present and non-blank, otherwise {@code null}. */
    public String nonBlankAttribute(String name) {
        String value = attributes.get(name);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    /** The value rule filters are tested against. */
    public String filterKey() {
        return kind.filterKey(attributes);
    }

    /** Returns {@code true} if the node carries a {@code lang} attribute. */
    public boolean isLocalized() {
        return attributes.containsKey("lang");
    }

    /** Returns the first child with the given tag, or {@code null}. */
    public SourceNode firstChild(String childTag) {
        for (SourceNode child : children) {
            if (child.tag.equals(childTag)) {
                return child;
            }
        }
        return null;
    }
}
