package io.entryrender.core.engine;

import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.RuleFilter;
import io.entryrender.core.model.SourceNode;
import io.entryrender.core.model.Visibility;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the children of one parent node in two passes.
 *
 * <p>
 * <b>Profile-ordered pass:</b> rules are visited in ascending display order. Groupable kinds
 * (relations, traits, annotations) are combined into one container per rule, joined by the
 * rule's separator. Other kinds render each matching child individually, in document order.
 *
 * <p>
 * <b>Leftover pass:</b> every child still unvisited renders in document order, unless a negated
 * filter term of its type names it or it is a form in another language than the inherited one.
 *
 * <p>
 * Under an entry, the shared category marker is emitted once, right before the first sense.
 */
final class ChildOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ChildOrchestrator.class);

    /** Class of the entry-level category marker. */
    static final String CATEGORY_MARKER_CLASS = "entry-pos";

    private final TreeWalker walker;
    private final TextExtractor extractor;

    ChildOrchestrator(TreeWalker walker, TextExtractor extractor) {
        this.walker = walker;
        this.extractor = extractor;
    }

    /** Renders the parent's children; pieces are joined with single spaces. */
    String render(SourceNode parent, RenderContext ctx) {
        if (parent.children().isEmpty()) {
            return "";
        }
        List<String> pieces = new ArrayList<>();
        profileOrderedPass(parent, ctx, pieces);
        leftoverPass(parent, ctx, pieces);
        return String.join(" ", pieces);
    }

    private void profileOrderedPass(SourceNode parent, RenderContext ctx, List<String> pieces) {
        for (RenderRule rule : ctx.rules().ordered()) {
            List<SourceNode> ofType = childrenOfType(parent, rule.nodeType());
            if (ofType.isEmpty()) {
                continue;
            }
            if (NodeKind.forTag(rule.nodeType()).isGroupable()) {
                renderGroup(rule, ofType, ctx, pieces);
            } else {
                for (SourceNode child : ofType) {
                    if (ctx.isVisited(child) || !rule.accepts(child) || !passesLanguage(child, ctx)) {
                        continue;
                    }
                    injectCategoryMarker(parent, child, ctx, pieces);
                    add(pieces, walker.render(child, ctx, rule));
                }
            }
        }
    }

    private void renderGroup(RenderRule rule, List<SourceNode> ofType, RenderContext ctx, List<String> pieces) {
        List<SourceNode> members = new ArrayList<>();
        for (SourceNode child : ofType) {
            if (!ctx.isVisited(child) && rule.accepts(child)) {
                members.add(child);
            }
        }

        if (members.isEmpty()) {
            // nothing to group here; the rule's container stays available for later parents
            hideUnlisted(rule, ofType, ctx);
            return;
        }

        boolean firstEmission = ctx.markGroupEmitted(rule);
        List<String> texts = new ArrayList<>();
        for (SourceNode member : members) {
            if (!firstEmission) {
                // the rule already emitted its container under another parent
                add(pieces, walker.render(member, ctx, rule));
                continue;
            }
            ctx.markVisited(member);
            String text = extractor.extractDeep(member, ctx, rule);
            if (!text.isBlank()) {
                texts.add(text);
            }
        }
        hideUnlisted(rule, ofType, ctx);
        if (!firstEmission) {
            return;
        }

        if (rule.visibility() == Visibility.NEVER) {
            return;
        }
        String content = String.join(Markup.escape(rule.separator()), texts);
        if (content.isBlank() && rule.visibility() == Visibility.IF_CONTENT) {
            return;
        }
        pieces.add(Markup.wrap(rule, content));
    }

    private void leftoverPass(SourceNode parent, RenderContext ctx, List<String> pieces) {
        for (SourceNode child : parent.children()) {
            if (ctx.isVisited(child)) {
                continue;
            }
            if (isExcludedByNegation(child, ctx.rules().rulesFor(child.tag()))) {
                LOG.debug("Skipping <{}> '{}': excluded by filter", child.tag(), child.filterKey());
                ctx.markSubtreeVisited(child);
                continue;
            }
            if (!passesLanguage(child, ctx)) {
                continue;
            }
            injectCategoryMarker(parent, child, ctx, pieces);
            add(pieces, walker.render(child, ctx, null));
        }
    }

    private static void hideUnlisted(RenderRule rule, List<SourceNode> ofType, RenderContext ctx) {
        if (isExhaustiveWhitelist(rule, ctx)) {
            LOG.debug("Rule '{}' filter '{}' is exhaustive; hiding unlisted siblings", rule.nodeType(),
                    rule.filter().expression());
            ofType.forEach(ctx::markSubtreeVisited);
        }
    }

    /**
     * A single inclusion-only rule for its type that lists two or more terms, or sets no aspect,
     * owns every child of that type: unlisted ones must not surface in the leftover pass.
     */
    private static boolean isExhaustiveWhitelist(RenderRule rule, RenderContext ctx) {
        RuleFilter filter = rule.filter();
        if (filter == null || !filter.isInclusionOnly()) {
            return false;
        }
        if (ctx.rules().rulesFor(rule.nodeType()).size() != 1) {
            return false;
        }
        return filter.inclusions().size() >= 2 || rule.aspect() == null;
    }

    private static boolean isExcludedByNegation(SourceNode child, List<RenderRule> rules) {
        String key = child.filterKey();
        for (RenderRule rule : rules) {
            if (rule.hasFilter() && rule.filter().excludes(key)) {
                return true;
            }
        }
        return false;
    }

    private static boolean passesLanguage(SourceNode child, RenderContext ctx) {
        return child.kind() != NodeKind.FORM || !child.isLocalized() || ctx.acceptsLanguage(child);
    }

    private static void injectCategoryMarker(
            SourceNode parent, SourceNode child, RenderContext ctx, List<String> pieces) {
        if (parent.kind() != NodeKind.ENTRY || !"sense".equals(child.tag())) {
            return;
        }
        String category = ctx.sharedCategory();
        if (category == null || ctx.categoryShown()) {
            return;
        }
        ctx.markCategoryShown();
        pieces.add(Markup.span(CATEGORY_MARKER_CLASS, Markup.escape(category)));
    }

    private static List<SourceNode> childrenOfType(SourceNode parent, String tag) {
        List<SourceNode> result = new ArrayList<>();
        for (SourceNode child : parent.children()) {
            if (child.tag().equals(tag)) {
                result.add(child);
            }
        }
        return result;
    }

    private static void add(List<String> pieces, String piece) {
        if (piece != null && !piece.isBlank()) {
            pieces.add(piece);
        }
    }
}
