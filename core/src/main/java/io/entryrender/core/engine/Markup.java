package io.entryrender.core.engine;

import io.entryrender.core.model.RenderRule;

/** Markup building helpers shared by the extractor, the orchestrator and the walker. */
final class Markup {

    private Markup() {
        // utility class
    }

    /** Escapes text for use in element content. Quotes and apostrophes are kept as they are. */
    static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Escapes a raw value for use inside a double-quoted attribute. */
    static String escapeAttribute(String value) {
        return quote(escape(value));
    }

    /** Makes text already escaped for element content safe inside a double-quoted attribute. */
    static String quote(String escapedText) {
        return escapedText.replace("\"", "&quot;");
    }

    /** Emits {@code <span class="cls">content</span>}; content must already be markup. */
    static String span(String cssClass, String content) {
        return "<span class=\"" + escapeAttribute(cssClass) + "\">" + content + "</span>";
    }

    /**
     * Wraps content in the rule's element ({@code span} or {@code div}) with its class and prefix
     * and suffix decorations. Content must already be markup.
     */
    static String wrap(RenderRule rule, String content) {
        String tag = rule.mode().tag();
        StringBuilder sb = new StringBuilder(content.length() + 64);
        sb.append('<').append(tag);
        if (!rule.cssClass().isEmpty()) {
            sb.append(" class=\"").append(escapeAttribute(rule.cssClass())).append('"');
        }
        sb.append('>');
        if (!rule.prefix().isEmpty()) {
            sb.append(span("prefix", escape(rule.prefix())));
        }
        sb.append(content);
        if (!rule.suffix().isEmpty()) {
            sb.append(span("suffix", escape(rule.suffix())));
        }
        sb.append("</").append(tag).append('>');
        return sb.toString();
    }

    /** Joins two markup pieces with a single space, dropping blank ones. */
    static String join(String first, String second) {
        boolean hasFirst = first != null && !first.isBlank();
        boolean hasSecond = second != null && !second.isBlank();
        if (hasFirst && hasSecond) {
            return first + " " + second;
        }
        return hasFirst ? first : hasSecond ? second : "";
    }

    /** Collapses runs of whitespace into single spaces and trims. */
    static String collapse(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
