package io.entryrender.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed display profile: a named, ordered list of {@link RenderRule}s.
 *
 * <p>
 * Immutable, thread-safe. Created at load time by {@code DisplayProfileParser}.
 *
 * @param id          profile identifier (e.g. "default")
 * @param name        human-readable name, may be null
 * @param description human-readable description, may be null
 * @param rules       rules in declaration order (ties in display order resolve by this order)
 */
public record DisplayProfile(String id, String name, String description, List<RenderRule> rules) {

    /** Canonical constructor. Validates required fields. */
    public DisplayProfile {
        Objects.requireNonNull(id, "profile id must not be null");
        rules = rules != null ? Collections.unmodifiableList(rules) : List.of();
    }

    /** Returns the rules configured for the given element type, in declaration order. */
    public List<RenderRule> rulesFor(String nodeType) {
        return rules.stream().filter(r -> r.nodeType().equals(nodeType)).toList();
    }
}
