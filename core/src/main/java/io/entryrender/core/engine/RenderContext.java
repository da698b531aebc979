package io.entryrender.core.engine;

import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceNode;
import java.util.BitSet;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Per-call render state threaded through the recursive walk.
 *
 * <p>
 * A context is created for exactly one render call and discarded afterwards. Derived contexts
 * ({@link #withLanguage(String)}) carry a different inherited language but share the visited
 * set, the category flag and the emitted-group set of their origin.
 */
final class RenderContext {

    /** Language value that disables form filtering. */
    static final String ANY_LANGUAGE = "*";

    private final State state;
    private final String language;

    private RenderContext(State state, String language) {
        this.state = state;
        this.language = language;
    }

    static RenderContext create(List<RenderRule> rules, int nodeCount, String sharedCategory, String language) {
        String category = sharedCategory != null && !sharedCategory.isBlank() ? sharedCategory.trim() : null;
        return new RenderContext(new State(new RuleIndex(rules), nodeCount, category), language);
    }

    /** Returns a context inheriting the given language and sharing this call's state. */
    RenderContext withLanguage(String newLanguage) {
        if (newLanguage == null || newLanguage.equals(language)) {
            return this;
        }
        return new RenderContext(state, newLanguage);
    }

    RuleIndex rules() {
        return state.rules;
    }

    /** The inherited language, or {@code null} when none is set. */
    String language() {
        return language;
    }

    /** The inherited language for label lookups: {@code null} for none or the wildcard. */
    String displayLanguage() {
        return language == null || ANY_LANGUAGE.equals(language) ? null : language;
    }

    /**
     * Tests whether a localized node passes the inherited language. Nodes without a
     * {@code lang} attribute always pass, as does everything under the wildcard.
     */
    boolean acceptsLanguage(SourceNode node) {
        if (language == null || ANY_LANGUAGE.equals(language)) {
            return true;
        }
        String lang = node.attribute("lang");
        return lang == null || lang.equalsIgnoreCase(language);
    }

    /** Marks the node visited; returns {@code false} if it already was. */
    boolean markVisited(SourceNode node) {
        if (state.visited.get(node.index())) {
            return false;
        }
        state.visited.set(node.index());
        return true;
    }

    /** Marks the node and every descendant visited. */
    void markSubtreeVisited(SourceNode node) {
        state.visited.set(node.index());
        for (SourceNode child : node.children()) {
            markSubtreeVisited(child);
        }
    }

    boolean isVisited(SourceNode node) {
        return state.visited.get(node.index());
    }

    /** The entry-level shared category, or {@code null}. */
    String sharedCategory() {
        return state.sharedCategory;
    }

    boolean categoryShown() {
        return state.categoryShown;
    }

    void markCategoryShown() {
        state.categoryShown = true;
    }

    /** Records that the rule emitted its group container; returns {@code false} if it already had. */
    boolean markGroupEmitted(RenderRule rule) {
        return state.emittedGroups.add(rule);
    }

    private static final class State {
        private final RuleIndex rules;
        private final BitSet visited;
        private final String sharedCategory;
        private final Set<RenderRule> emittedGroups = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean categoryShown;

        private State(RuleIndex rules, int nodeCount, String sharedCategory) {
            this.rules = rules;
            this.visited = new BitSet(nodeCount);
            this.sharedCategory = sharedCategory;
        }
    }
}
