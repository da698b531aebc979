package io.entryrender.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parsed filter expression of a {@link RenderRule}: comma-separated terms where {@code !term} is
 * an exclusion and anything else an inclusion. Terms are trimmed and compared case-insensitively
 * against a node's filter key (see {@link NodeKind#filterKey}).
 *
 * <p>
 * A node passes when its key is not excluded and, if any inclusion is listed, the key is one of
 * the inclusions.
 *
 * @param expression the original expression text
 * @param inclusions lower-cased inclusion terms
 * @param exclusions lower-cased exclusion terms (without the leading {@code !})
 */
public record RuleFilter(String expression, List<String> inclusions, List<String> exclusions) {

    public RuleFilter {
        inclusions = inclusions != null ? Collections.unmodifiableList(inclusions) : List.of();
        exclusions = exclusions != null ? Collections.unmodifiableList(exclusions) : List.of();
    }

    /**
     * Parses a filter expression.
     *
     * @return the parsed filter, or {@code null} when the expression is null or blank
     */
    public static RuleFilter parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        List<String> inclusions = new ArrayList<>();
        List<String> exclusions = new ArrayList<>();
        for (String raw : expression.split(",")) {
            String term = raw.trim().toLowerCase(Locale.ROOT);
            if (term.startsWith("!")) {
                term = term.substring(1).trim();
                if (!term.isEmpty()) {
                    exclusions.add(term);
                }
            } else if (!term.isEmpty()) {
                inclusions.add(term);
            }
        }
        if (inclusions.isEmpty() && exclusions.isEmpty()) {
            return null;
        }
        return new RuleFilter(expression.trim(), inclusions, exclusions);
    }

    /** Tests whether a node with the given filter key passes this filter. */
    public boolean matches(String key) {
        if (excludes(key)) {
            return false;
        }
        if (inclusions.isEmpty()) {
            return true;
        }
        return key != null && inclusions.contains(normalize(key));
    }

    /** Returns {@code true} if the key is named by a negated term. */
    public boolean excludes(String key) {
        return key != null && exclusions.contains(normalize(key));
    }

    /** Returns {@code true} if the filter carries at least one negated term. */
    public boolean hasExclusions() {
        return !exclusions.isEmpty();
    }

    /** Returns {@code true} if the filter lists only positive terms. */
    public boolean isInclusionOnly() {
        return !inclusions.isEmpty() && exclusions.isEmpty();
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
