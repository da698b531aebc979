package io.entryrender.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.entryrender.core.model.DisplayProfile;
import io.entryrender.core.model.RenderRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EntryPreviewService")
class EntryPreviewServiceTest {

    private final EntryPreviewService preview = new EntryPreviewService(new EntryRenderer());

    private final DisplayProfile profile = new DisplayProfile(
            "preview",
            "Preview",
            null,
            List.of(
                    RenderRule.builder("lexical-unit").order(10).cssClass("headword").build(),
                    RenderRule.builder("sense").order(20).block().build(),
                    RenderRule.builder("grammatical-info").order(30).cssClass("pos").build(),
                    RenderRule.builder("gloss").order(40).build()));

    @Test
    @DisplayName("output wrapped in the preview container with the shared category hoisted")
    void wrappedAndHoisted() {
        String xml = """
                <entry>
                  <lexical-unit><form lang="en"><text>cat</text></form></lexical-unit>
                  <sense><grammatical-info value="Noun"/><gloss lang="en"><text>feline</text></gloss></sense>
                  <sense><grammatical-info value="Noun"/><gloss lang="en"><text>jazz fan</text></gloss></sense>
                </entry>
                """;

        assertThat(preview.render(xml, profile))
                .isEqualTo("<div class=\"lift-entry-rendered\"><span class=\"headword\">cat</span>"
                        + " <span class=\"entry-pos\">Noun</span>"
                        + " <div class=\"sense\"><span class=\"gloss\">feline</span></div>"
                        + " <div class=\"sense\"><span class=\"gloss\">jazz fan</span></div></div>");
    }

    @Test
    @DisplayName("differing categories stay at sense level")
    void notHoisted() {
        String xml = "<entry><sense><grammatical-info value=\"Noun\"/></sense>"
                + "<sense><grammatical-info value=\"Verb\"/></sense></entry>";

        assertThat(preview.render(xml, profile))
                .isEqualTo("<div class=\"lift-entry-rendered\">"
                        + "<div class=\"sense\"><span class=\"pos\">Noun</span></div>"
                        + " <div class=\"sense\"><span class=\"pos\">Verb</span></div></div>");
    }

    @Test
    @DisplayName("placeholders are wrapped too")
    void placeholderWrapped() {
        assertThat(preview.render("", profile))
                .isEqualTo("<div class=\"lift-entry-rendered\">" + EntryRenderer.EMPTY_PLACEHOLDER + "</div>");
    }
}
