package io.entryrender.core.model;

import java.util.Locale;

/** Wrapper element used for a rendered node: {@code span} for inline, {@code div} for block. */
public enum DisplayMode {
    INLINE("span"),
    BLOCK("div");

    private final String tag;

    DisplayMode(String tag) {
        this.tag = tag;
    }

    /** The markup element name. */
    public String tag() {
        return tag;
    }

    /**
     * Parses a profile-file value ({@code inline} or {@code block}), case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static DisplayMode fromConfig(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "inline" -> INLINE;
            case "block" -> BLOCK;
            default -> throw new IllegalArgumentException(
                    "Unknown display mode '" + value + "': must be 'inline' or 'block'");
        };
    }
}
