package io.entryrender.core.engine;

import io.entryrender.core.model.RenderRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a rule list: all rules in ascending display order, and the rules of each
 * element type in listed order. Sorting is stable, so equal orders keep their listed order.
 */
final class RuleIndex {

    private final List<RenderRule> ordered;
    private final Map<String, List<RenderRule>> byType;

    RuleIndex(List<RenderRule> rules) {
        List<RenderRule> sorted = new ArrayList<>(rules != null ? rules : List.of());
        sorted.sort(Comparator.comparingInt(RenderRule::order));
        this.ordered = List.copyOf(sorted);

        Map<String, List<RenderRule>> types = new LinkedHashMap<>();
        if (rules != null) {
            for (RenderRule rule : rules) {
                types.computeIfAbsent(rule.nodeType(), k -> new ArrayList<>()).add(rule);
            }
        }
        types.replaceAll((k, v) -> List.copyOf(v));
        this.byType = Map.copyOf(types);
    }

    /** All rules, ascending by {@link RenderRule#order()}. */
    List<RenderRule> ordered() {
        return ordered;
    }

    /** Rules for one element type in listed order; empty if none. */
    List<RenderRule> rulesFor(String nodeType) {
        return byType.getOrDefault(nodeType, List.of());
    }

    int size() {
        return ordered.size();
    }
}
