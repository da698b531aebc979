package io.entryrender.core.model;

import java.util.Locale;

/**
 * How a range-backed value (relation type, grammatical category, trait value) is shown.
 * {@link #FULL} shows the stored value as-is; {@link #LABEL} and {@link #ABBR} ask the configured
 * {@code LabelResolver} for a display label or abbreviation.
 */
public enum DisplayAspect {
    FULL,
    LABEL,
    ABBR;

    /**
     * Parses a profile-file value ({@code full}, {@code label}, {@code abbr}).
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static DisplayAspect fromConfig(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "full" -> FULL;
            case "label" -> LABEL;
            case "abbr" -> ABBR;
            default -> throw new IllegalArgumentException(
                    "Invalid display aspect '" + value + "': must be one of full, label, abbr");
        };
    }
}
