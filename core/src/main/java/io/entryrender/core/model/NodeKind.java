package io.entryrender.core.model;

import java.util.Map;

/**
 * Closed set of entry node kinds. Each element name maps to exactly one kind; the kind decides
 * how the node's own text is extracted, whether it is structural, whether several siblings of
 * the same type are grouped into one container, and which attribute a {@link RuleFilter} tests.
 */
public enum NodeKind {
    /** The entry root. Structural. */
    ENTRY,
    /** A sense or subsense. Structural. */
    SENSE,
    /** A language-tagged text container. */
    FORM,
    /** A text leaf; its content may contain inline spans. */
    TEXT,
    /** A relation to another entry or sense. Groupable. */
    CROSS_REFERENCE,
    /** A variant form with an optional variant type. */
    VARIANT,
    /** An image reference with an optional caption. */
    ILLUSTRATION,
    /** A grammatical category; value read from the {@code value} attribute. */
    GRAMMATICAL_INFO,
    /** A name/value trait. Groupable. */
    TRAIT,
    /** A name/value annotation. Groupable. */
    ANNOTATION,
    /** A typed custom field. */
    FIELD,
    /** Any other element; text comes from its forms or its own text. */
    CONTENT;

    /** Maps a namespace-stripped element name to its kind. */
    public static NodeKind forTag(String tag) {
        return switch (tag) {
            case "entry" -> ENTRY;
            case "sense", "subsense" -> SENSE;
            case "form" -> FORM;
            case "text" -> TEXT;
            case "relation" -> CROSS_REFERENCE;
            case "variant" -> VARIANT;
            case "illustration" -> ILLUSTRATION;
            case "grammatical-info" -> GRAMMATICAL_INFO;
            case "trait" -> TRAIT;
            case "annotation" -> ANNOTATION;
            case "field" -> FIELD;
            default -> CONTENT;
        };
    }

    /** Structural kinds contribute no own text; their output is their children's. */
    public boolean isStructural() {
        return this == ENTRY || this == SENSE;
    }

    /** Groupable kinds are combined into one container per rule under a parent. */
    public boolean isGroupable() {
        return this == CROSS_REFERENCE || this == TRAIT || this == ANNOTATION;
    }

    /** Kinds whose displayed value is read from the {@code value} attribute. */
    public boolean readsValueAttribute() {
        return this == GRAMMATICAL_INFO || this == TRAIT || this == ANNOTATION;
    }

    /**
     * Returns the attribute value a rule filter is tested against: the preserved original type
     * (or type) for relations, the name for traits and annotations, the value for grammatical
     * categories, and the type for everything else.
     */
    public String filterKey(Map<String, String> attributes) {
        return switch (this) {
            case CROSS_REFERENCE -> {
                String original = attributes.get("data-original-type");
                yield original != null && !original.isBlank() ? original : attributes.get("type");
            }
            case TRAIT, ANNOTATION -> attributes.get("name");
            case GRAMMATICAL_INFO -> attributes.get("value");
            default -> attributes.get("type");
        };
    }
}
