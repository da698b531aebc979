package io.entryrender.core.model;

import java.util.Locale;

/** Visibility policy of a {@link RenderRule}. */
public enum Visibility {
    /** Always wrap, even when the content is blank. */
    ALWAYS("always"),
    /** Suppress the node entirely when its combined content is blank. */
    IF_CONTENT("if-content"),
    /** Never emit output; the node still counts as processed. */
    NEVER("never");

    private final String configValue;

    Visibility(String configValue) {
        this.configValue = configValue;
    }

    /** The value used in profile files (e.g. {@code "if-content"}). */
    public String configValue() {
        return configValue;
    }

    /**
     * Parses a profile-file value, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Visibility fromConfig(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Visibility visibility : values()) {
            if (visibility.configValue.equals(normalized)) {
                return visibility;
            }
        }
        throw new IllegalArgumentException(
                "Unknown visibility '" + value + "': must be one of always, if-content, never");
    }
}
