package io.entryrender.core.engine;

import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceNode;
import io.entryrender.core.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders one node and, through the {@link ChildOrchestrator}, its subtree.
 *
 * <p>
 * A node renders at most once per call: the first visit marks it, later visits return nothing.
 * Suppressed nodes ({@code never}, a rejecting filter, an excluded cross-reference) stay marked.
 */
final class TreeWalker {

    private static final Logger LOG = LoggerFactory.getLogger(TreeWalker.class);

    private final TextExtractor extractor;
    private final ChildOrchestrator orchestrator;

    TreeWalker(TextExtractor extractor) {
        this.extractor = extractor;
        this.orchestrator = new ChildOrchestrator(this, extractor);
    }

    /**
     * Renders a node.
     *
     * @param preselected rule chosen by the orchestrator, or {@code null} to resolve one from the
     *                    rules configured for the node's type
     * @return markup, empty when suppressed or already rendered
     */
    String render(SourceNode node, RenderContext ctx, RenderRule preselected) {
        if (!ctx.markVisited(node)) {
            return "";
        }

        RenderRule rule;
        if (preselected != null) {
            if (!preselected.accepts(node)) {
                return "";
            }
            rule = preselected;
        } else {
            RuleResolver.Resolution resolution =
                    RuleResolver.resolve(node, ctx.rules().rulesFor(node.tag()));
            if (resolution.excluded()) {
                LOG.debug("Excluding <{}> '{}': no rule of the partition matches", node.tag(), node.filterKey());
                return "";
            }
            rule = resolution.rule();
        }
        if (rule != null && rule.visibility() == Visibility.NEVER) {
            return "";
        }

        RenderContext scoped = rule != null ? ctx.withLanguage(rule.forcedLanguage()) : ctx;

        String own = node.kind().isStructural() ? "" : extractor.extract(node, scoped, rule);
        if (node.kind() == NodeKind.GRAMMATICAL_INFO && isSharedCategory(node, ctx)) {
            if (ctx.categoryShown()) {
                LOG.debug("Suppressing <{}> '{}': shown at entry level", node.tag(), node.filterKey());
                return "";
            } else {
                ctx.markCategoryShown();
            }
        }
        String content = Markup.join(own, orchestrator.render(node, scoped));

        if (rule == null) {
            return content;
        }
        if (content.isBlank() && rule.visibility() == Visibility.IF_CONTENT) {
            return "";
        }
        return Markup.wrap(rule, content);
    }

    private static boolean isSharedCategory(SourceNode node, RenderContext ctx) {
        String shared = ctx.sharedCategory();
        String value = node.nonBlankAttribute("value");
        return shared != null && value != null && value.equalsIgnoreCase(shared);
    }
}
