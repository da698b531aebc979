package io.entryrender.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.entryrender.core.model.DisplayAspect;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.spi.LabelResolver;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("EntryRenderer")
class EntryRendererTest {

    private static final String ENTRY = """
            <entry id="attest_1">
              <lexical-unit><form lang="en"><text>attest to sth</text></form></lexical-unit>
              <pronunciation><form lang="en-fonipa"><text>əˈtest</text></form></pronunciation>
              <sense>
                <grammatical-info value="Verb"/>
                <definition>
                  <form lang="en"><text>to show that something is true</text></form>
                  <form lang="pl"><text>świadczyć o czymś</text></form>
                </definition>
                <relation type="synonym" ref="prove_1" data-headword="prove"/>
                <relation type="synonym" ref="confirm_1" data-headword="confirm"/>
              </sense>
            </entry>
            """;

    private static final List<RenderRule> RULES = List.of(
            RenderRule.builder("lexical-unit").order(10).cssClass("headword lexical-unit").build(),
            RenderRule.builder("pronunciation").order(20).prefix("/").suffix("/").build(),
            RenderRule.builder("sense").order(30).block().build(),
            RenderRule.builder("grammatical-info").order(40).cssClass("pos").build(),
            RenderRule.builder("definition").order(50).forcedLanguage("en").build(),
            RenderRule.builder("relation").order(60).separator("; ").build());

    private final EntryRenderer renderer = new EntryRenderer();

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("complete entry")
        void completeEntry() {
            assertThat(renderer.render(ENTRY, RULES))
                    .isEqualTo("<span class=\"headword lexical-unit\">attest to sth</span>"
                            + " <span class=\"pronunciation\"><span class=\"prefix\">/</span>əˈtest"
                            + "<span class=\"suffix\">/</span></span>"
                            + " <div class=\"sense\"><span class=\"pos\">Verb</span>"
                            + " <span class=\"definition\">to show that something is true</span>"
                            + " <span class=\"relation\">synonym prove; synonym confirm</span></div>");
        }

        @Test
        @DisplayName("same input twice → identical output")
        void idempotent() {
            assertThat(renderer.render(ENTRY, RULES)).isEqualTo(renderer.render(ENTRY, RULES));
        }

        @Test
        @DisplayName("every source text appears at most once")
        void noDuplication() {
            String html = renderer.render(ENTRY, RULES);

            assertThat(html.split("attest to sth", -1)).hasSize(2);
            assertThat(html.split("prove", -1)).hasSize(2);
            assertThat(html.split("Verb", -1)).hasSize(2);
        }

        @Test
        @DisplayName("shared category is shown once at entry level")
        void sharedCategory() {
            String html = renderer.render(ENTRY, RULES, "Verb");

            assertThat(html).contains("<span class=\"entry-pos\">Verb</span>");
            assertThat(html.split("Verb", -1)).hasSize(2);
        }

        @Test
        @DisplayName("detected category is hoisted when all senses agree")
        void detectedCategory() {
            String html = renderer.renderWithDetectedCategory(ENTRY, RULES);

            assertThat(html).contains("<span class=\"entry-pos\">Verb</span>");
            assertThat(html).doesNotContain("<span class=\"pos\">");
        }

        @Test
        @DisplayName("default language option filters forms at the root")
        void defaultLanguage() {
            EntryRenderer polish = new EntryRenderer(new RenderOptions(null, "pl"));
            List<RenderRule> rules = List.of(RenderRule.builder("definition").build());

            String html = polish.render(ENTRY, rules);

            assertThat(html).contains("<span class=\"definition\">świadczyć o czymś</span>");
            assertThat(html).doesNotContain("to show that");
        }

        @Test
        @DisplayName("namespaced input renders like plain input")
        void namespaced() {
            String xml = "<lift:entry xmlns:lift=\"http://fieldworks.sil.org/schemas/lift/0.13\">"
                    + "<lift:lexical-unit><lift:form lang=\"en\"><lift:text>namespaced</lift:text></lift:form>"
                    + "</lift:lexical-unit></lift:entry>";

            assertThat(renderer.render(xml, RULES))
                    .isEqualTo("<span class=\"headword lexical-unit\">namespaced</span>");
        }

        @Test
        @DisplayName("markup characters in text are escaped")
        void escaped() {
            String xml = "<entry><lexical-unit><form lang=\"en\"><text>R&amp;D &lt;lab&gt;</text></form>"
                    + "</lexical-unit></entry>";

            assertThat(renderer.render(xml, RULES))
                    .isEqualTo("<span class=\"headword lexical-unit\">R&amp;D &lt;lab&gt;</span>");
        }

        @Test
        @DisplayName("apostrophes and quotes in text stay literal")
        void quotesKept() {
            String xml = "<entry><sense><example><form lang=\"en\"><text>It's no \"contest\".</text></form>"
                    + "</example></sense></entry>";

            assertThat(renderer.render(xml, List.of(RenderRule.builder("example").build())))
                    .isEqualTo("<span class=\"example\">It's no \"contest\".</span>");
        }

        @Test
        @DisplayName("null rule list renders everything unwrapped")
        void nullRules() {
            assertThat(renderer.render("<entry><note>plain</note></entry>", null)).isEqualTo("plain");
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("unclosed tag → recovered text fragments")
        void recovered() {
            String xml = "<entry><lexical-unit><form lang=\"en\"><text>broken entry</text></form>"
                    + "</lexical-unit><sense><gloss lang=\"en\"><text>still &amp; here</text></gloss>";

            assertThat(renderer.render(xml, RULES))
                    .isEqualTo("<span class=\"recovered-text\">broken entry</span>"
                            + " <span class=\"recovered-text\">still &amp; here</span>");
        }

        @Test
        @DisplayName("namespaced malformed input is recovered too")
        void recoveredNamespaced() {
            String xml = "<lift:entry xmlns:lift=\"urn:lift\"><lift:text>salvaged</lift:text>";

            assertThat(renderer.render(xml, RULES)).isEqualTo("<span class=\"recovered-text\">salvaged</span>");
        }

        @ParameterizedTest
        @ValueSource(strings = {"<entry><sense>", "this is not xml", "<entry><text></text>"})
        @DisplayName("nothing recoverable → empty placeholder, never entry-error")
        void unrecoverable(String xml) {
            String html = renderer.render(xml, RULES);

            assertThat(html).isEqualTo(EntryRenderer.EMPTY_PLACEHOLDER);
            assertThat(html).doesNotContain("entry-error");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   \n "})
        @DisplayName("blank input → empty placeholder")
        void blankInput(String xml) {
            assertThat(renderer.render(xml, RULES)).isEqualTo(EntryRenderer.EMPTY_PLACEHOLDER);
        }

        @Test
        @DisplayName("entry without visible content → empty placeholder")
        void noContent() {
            assertThat(renderer.render("<entry><sense/></entry>", RULES))
                    .isEqualTo("<div class=\"entry-empty\">No content to display</div>");
        }

        @Test
        @DisplayName("unexpected failure → error placeholder with reason")
        void unexpectedFailure() {
            LabelResolver failing = (range, value, aspect, lang) -> {
                throw new IllegalStateException("range store <offline>");
            };
            EntryRenderer failingRenderer = new EntryRenderer(RenderOptions.DEFAULT, failing, null);
            List<RenderRule> rules = List.of(
                    RenderRule.builder("relation").aspect(DisplayAspect.LABEL).build());

            assertThat(failingRenderer.render(ENTRY, rules))
                    .isEqualTo("<div class=\"entry-error\">Error rendering entry: range store &lt;offline&gt;</div>");
        }
    }
}
