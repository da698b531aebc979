package io.entryrender.core.engine;

import io.entryrender.core.model.DisplayAspect;
import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceNode;
import io.entryrender.core.spi.LabelResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Computes the text a node contributes on its own, before its children are rendered.
 *
 * <p>
 * The default strategy collects the node's language-tagged {@code form} children that pass the
 * inherited language and joins their texts with one space; without any, the node's own direct
 * text is used. Cross-references, variants, illustrations, attribute-valued nodes and fields
 * override this per {@link NodeKind}. All returned text is escaped markup; extraction never
 * throws.
 */
final class TextExtractor {

    private static final Pattern ABSOLUTE_REF = Pattern.compile("^(?:[a-zA-Z][a-zA-Z0-9+.-]*:|//|/).*");

    private final RenderOptions options;
    private final LabelResolver labels;

    TextExtractor(RenderOptions options, LabelResolver labels) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.labels = labels != null ? labels : LabelResolver.NONE;
    }

    /**
     * Extracts the node's own text.
     *
     * @param rule the governing rule, or {@code null}; only its aspect is consulted
     * @return escaped markup, possibly empty
     */
    String extract(SourceNode node, RenderContext ctx, RenderRule rule) {
        DisplayAspect aspect = rule != null ? rule.aspect() : null;
        return switch (node.kind()) {
            case ENTRY, SENSE -> "";
            case TEXT -> textContent(node, ctx);
            case CROSS_REFERENCE -> crossReference(node, ctx, aspect);
            case VARIANT -> variant(node, ctx, aspect);
            case ILLUSTRATION -> illustration(node, ctx);
            case GRAMMATICAL_INFO, TRAIT, ANNOTATION -> attributeValue(node, ctx, aspect);
            case FIELD -> field(node, ctx);
            case FORM, CONTENT -> orOwnText(localizedForms(node, ctx), node);
        };
    }

    /**
     * Extracts a grouped item: its own text, or, when that is empty, the text of its whole
     * subtree. The subtree is marked visited since grouped items are never walked individually.
     */
    String extractDeep(SourceNode node, RenderContext ctx, RenderRule rule) {
        String text = extract(node, ctx, rule);
        if (text.isBlank()) {
            List<String> parts = new ArrayList<>();
            collectDescendantText(node, ctx, parts);
            text = String.join(" ", parts);
        }
        ctx.markSubtreeVisited(node);
        return text;
    }

    // --- Per-kind strategies ---

    private String textContent(SourceNode node, RenderContext ctx) {
        // inline spans inside a text element are part of its content
        for (SourceNode child : node.children()) {
            ctx.markSubtreeVisited(child);
        }
        return Markup.escape(node.text());
    }

    private String crossReference(SourceNode node, RenderContext ctx, DisplayAspect aspect) {
        String type = node.nonBlankAttribute("type");
        String label = node.nonBlankAttribute("data-headword");
        if (label == null) {
            label = node.nonBlankAttribute("ref");
        }
        String shownType = type != null ? displayValue("lexical-relation", type, aspect, ctx) : null;
        return Markup.escape(joinNonBlank(shownType, label));
    }

    private String variant(SourceNode node, RenderContext ctx, DisplayAspect aspect) {
        String typeLabel = node.nonBlankAttribute("data-type-label");
        if (typeLabel == null) {
            String type = node.nonBlankAttribute("type");
            if (type == null) {
                for (SourceNode child : node.children()) {
                    if (child.kind() == NodeKind.TRAIT && "type".equals(child.attribute("name"))) {
                        type = child.nonBlankAttribute("value");
                        ctx.markSubtreeVisited(child);
                        break;
                    }
                }
            }
            typeLabel = type != null ? displayValue("variant-type", type, aspect, ctx) : null;
        }
        String forms = localizedForms(node, ctx);
        String escapedLabel = Markup.escape(typeLabel);
        return Markup.join(escapedLabel, forms);
    }

    private String illustration(SourceNode node, RenderContext ctx) {
        String href = node.nonBlankAttribute("href");
        if (href == null) {
            return "";
        }
        String src = Markup.escapeAttribute(resolveAsset(href));
        String caption = "";
        SourceNode label = node.firstChild("label");
        if (label != null) {
            caption = localizedForms(label, ctx);
            ctx.markSubtreeVisited(label);
        }
        if (caption.isBlank()) {
            return "<img src=\"" + src + "\" alt=\"\" class=\"illustration-image\">";
        }
        return "<figure class=\"illustration-figure\"><img src=\"" + src + "\" alt=\"" + Markup.quote(caption)
                + "\" class=\"illustration-image\"><figcaption class=\"illustration-caption\">" + caption
                + "</figcaption></figure>";
    }

    private String attributeValue(SourceNode node, RenderContext ctx, DisplayAspect aspect) {
        String value = node.nonBlankAttribute("value");
        if (value == null) {
            return orOwnText(localizedForms(node, ctx), node);
        }
        String rangeId = node.kind() == NodeKind.GRAMMATICAL_INFO ? "grammatical-info" : node.attribute("name");
        return Markup.escape(displayValue(rangeId, value, aspect, ctx));
    }

    private String field(SourceNode node, RenderContext ctx) {
        String text = orOwnText(localizedForms(node, ctx), node);
        if (text.isBlank()) {
            String type = node.nonBlankAttribute("type");
            if (type != null && !hasContent(node)) {
                return Markup.escape("[" + type + "]");
            }
        }
        return text;
    }

    // --- Shared helpers ---

    /** Joins the texts of the node's localized forms that pass the inherited language. */
    String localizedForms(SourceNode node, RenderContext ctx) {
        List<String> texts = new ArrayList<>();
        for (SourceNode child : node.children()) {
            if (child.kind() != NodeKind.FORM || !child.isLocalized() || ctx.isVisited(child)) {
                continue;
            }
            if (!ctx.acceptsLanguage(child)) {
                continue;
            }
            String text = formText(child);
            ctx.markSubtreeVisited(child);
            if (!text.isBlank()) {
                texts.add(Markup.escape(text));
            }
        }
        return String.join(" ", texts);
    }

    private static String formText(SourceNode form) {
        List<String> parts = new ArrayList<>();
        for (SourceNode child : form.children()) {
            if (child.kind() == NodeKind.TEXT && !child.text().isBlank()) {
                parts.add(child.text());
            }
        }
        return parts.isEmpty() ? form.text() : String.join(" ", parts);
    }

    private void collectDescendantText(SourceNode node, RenderContext ctx, List<String> parts) {
        for (SourceNode child : node.children()) {
            if (child.kind() == NodeKind.FORM && child.isLocalized() && !ctx.acceptsLanguage(child)) {
                continue;
            }
            if (child.kind() == NodeKind.TEXT) {
                if (!child.text().isBlank()) {
                    parts.add(Markup.escape(child.text()));
                }
            } else {
                collectDescendantText(child, ctx, parts);
            }
        }
    }

    private String displayValue(String rangeId, String value, DisplayAspect aspect, RenderContext ctx) {
        if (aspect == null || aspect == DisplayAspect.FULL || rangeId == null) {
            return value;
        }
        return labels.resolve(rangeId, value, aspect, ctx.displayLanguage())
                .filter(label -> !label.isBlank())
                .orElse(value);
    }

    private String resolveAsset(String href) {
        if (ABSOLUTE_REF.matcher(href).matches()) {
            return href;
        }
        String relative = href.startsWith("./") ? href.substring(2) : href;
        return options.assetBasePath() + relative;
    }

    private static String orOwnText(String formsText, SourceNode node) {
        return !formsText.isBlank() ? formsText : Markup.escape(node.text());
    }

    private static boolean hasContent(SourceNode node) {
        if (!node.text().isBlank()) {
            return true;
        }
        for (SourceNode child : node.children()) {
            if (hasContent(child)) {
                return true;
            }
        }
        return false;
    }

    private static String joinNonBlank(String first, String second) {
        if (first == null) {
            return second != null ? second : "";
        }
        return second != null ? first + " " + second : first;
    }
}
