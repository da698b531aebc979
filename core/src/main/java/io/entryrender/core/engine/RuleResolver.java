package io.entryrender.core.engine;

import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceNode;
import java.util.List;

/**
 * Picks the rule that governs one node among the rules configured for its type.
 *
 * <p>
 * Precedence: the first candidate whose filter the node satisfies wins; otherwise the first
 * filter-less candidate applies. When no candidate applies the node renders unwrapped, except
 * for cross-references whose type is partitioned by two or more filtered rules: those are
 * excluded outright.
 */
final class RuleResolver {

    private RuleResolver() {
        // utility class
    }

    /**
     * Outcome of resolution.
     *
     * @param rule     the governing rule, or {@code null} for unwrapped rendering
     * @param excluded {@code true} if the node must render nothing
     */
    record Resolution(RenderRule rule, boolean excluded) {

        static final Resolution UNCONFIGURED = new Resolution(null, false);
        static final Resolution EXCLUDED = new Resolution(null, true);
    }

    static Resolution resolve(SourceNode node, List<RenderRule> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Resolution.UNCONFIGURED;
        }
        RenderRule fallback = null;
        boolean allFiltered = true;
        for (RenderRule candidate : candidates) {
            if (candidate.hasFilter()) {
                if (candidate.accepts(node)) {
                    return new Resolution(candidate, false);
                }
            } else {
                allFiltered = false;
                if (fallback == null) {
                    fallback = candidate;
                }
            }
        }
        if (fallback != null) {
            return new Resolution(fallback, false);
        }
        if (node.kind() == NodeKind.CROSS_REFERENCE && allFiltered && candidates.size() > 1) {
            return Resolution.EXCLUDED;
        }
        return Resolution.UNCONFIGURED;
    }
}
