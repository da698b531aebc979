package io.entryrender.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Salvages readable text from entry input that could not be parsed: the literal content of every
 * {@code <text>} element is recovered into a {@code recovered-text} span.
 */
final class FragmentRecovery {

    static final String RECOVERED_CLASS = "recovered-text";

    private static final Pattern TEXT_FRAGMENT = Pattern.compile("<text\\b[^>]*>([^<]+)");

    private FragmentRecovery() {
        // utility class
    }

    /** Returns the non-blank literal text fragments, whitespace-collapsed, in input order. */
    static List<String> recover(String normalizedXml) {
        List<String> fragments = new ArrayList<>();
        Matcher matcher = TEXT_FRAGMENT.matcher(normalizedXml);
        while (matcher.find()) {
            String text = Markup.collapse(decodeEntities(matcher.group(1)));
            if (!text.isEmpty()) {
                fragments.add(text);
            }
        }
        return fragments;
    }

    /** Renders recovered fragments as escaped spans joined by single spaces. */
    static String toMarkup(List<String> fragments) {
        List<String> spans = new ArrayList<>(fragments.size());
        for (String fragment : fragments) {
            spans.add(Markup.span(RECOVERED_CLASS, Markup.escape(fragment)));
        }
        return String.join(" ", spans);
    }

    private static String decodeEntities(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
