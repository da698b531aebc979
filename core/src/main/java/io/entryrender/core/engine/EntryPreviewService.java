package io.entryrender.core.engine;

import io.entryrender.core.model.DisplayProfile;
import java.util.Objects;

/**
 * Renders entry previews with a display profile. The grammatical category shared by all senses
 * is hoisted to entry level, and the markup is wrapped in the preview container.
 */
public final class EntryPreviewService {

    /** Class of the preview container. */
    public static final String PREVIEW_CLASS = "lift-entry-rendered";

    private final EntryRenderer renderer;

    public EntryPreviewService(EntryRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /** Renders one entry with the profile's rules. Never throws. */
    public String render(String xml, DisplayProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        String markup = renderer.renderWithDetectedCategory(xml, profile.rules());
        return "<div class=\"" + PREVIEW_CLASS + "\">" + markup + "</div>";
    }
}
