package io.entryrender.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RenderRule")
class RenderRuleTest {

    private static SourceNode relation(Map<String, String> attributes) {
        return new SourceNode(1, "relation", NodeKind.CROSS_REFERENCE, attributes, List.of(), "");
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("builder defaults: class = element, if-content, inline, ', ' separator")
        void builderDefaults() {
            RenderRule rule = RenderRule.builder("gloss").build();

            assertThat(rule.cssClass()).isEqualTo("gloss");
            assertThat(rule.visibility()).isEqualTo(Visibility.IF_CONTENT);
            assertThat(rule.mode()).isEqualTo(DisplayMode.INLINE);
            assertThat(rule.separator()).isEqualTo(", ");
            assertThat(rule.prefix()).isEmpty();
            assertThat(rule.suffix()).isEmpty();
            assertThat(rule.filter()).isNull();
            assertThat(rule.forcedLanguage()).isNull();
            assertThat(rule.aspect()).isNull();
        }

        @Test
        @DisplayName("canonical constructor normalizes nulls and blank language")
        void canonicalConstructorNormalizes() {
            RenderRule rule = new RenderRule("note", 5, null, null, null, null, null, null, null, "  ", null);

            assertThat(rule.cssClass()).isEmpty();
            assertThat(rule.visibility()).isEqualTo(Visibility.IF_CONTENT);
            assertThat(rule.mode()).isEqualTo(DisplayMode.INLINE);
            assertThat(rule.separator()).isEqualTo(RenderRule.DEFAULT_SEPARATOR);
            assertThat(rule.forcedLanguage()).isNull();
        }

        @Test
        @DisplayName("blank node type is rejected")
        void blankNodeTypeRejected() {
            assertThatThrownBy(() -> RenderRule.builder(" ").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nodeType");
        }
    }

    @Nested
    @DisplayName("Filter acceptance")
    class Acceptance {

        @Test
        @DisplayName("rule without filter accepts every node")
        void noFilterAcceptsAll() {
            RenderRule rule = RenderRule.builder("relation").build();

            assertThat(rule.hasFilter()).isFalse();
            assertThat(rule.accepts(relation(Map.of("type", "anything")))).isTrue();
        }

        @Test
        @DisplayName("relation filter tests the preserved original type first")
        void relationUsesOriginalType() {
            RenderRule rule = RenderRule.builder("relation").filter("antonym").build();

            assertThat(rule.accepts(relation(Map.of("type", "_component", "data-original-type", "Antonym"))))
                    .isTrue();
            assertThat(rule.accepts(relation(Map.of("type", "antonym", "data-original-type", "synonym"))))
                    .isFalse();
            assertThat(rule.accepts(relation(Map.of("type", "antonym")))).isTrue();
        }
    }

    @Test
    @DisplayName("enum config values parse case-insensitively and reject unknowns")
    void enumConfigValues() {
        assertThat(Visibility.fromConfig("If-Content")).isEqualTo(Visibility.IF_CONTENT);
        assertThat(DisplayMode.fromConfig("BLOCK").tag()).isEqualTo("div");
        assertThat(DisplayAspect.fromConfig("abbr")).isEqualTo(DisplayAspect.ABBR);
        assertThatThrownBy(() -> Visibility.fromConfig("sometimes")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DisplayMode.fromConfig("table")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DisplayAspect.fromConfig("short")).isInstanceOf(IllegalArgumentException.class);
    }
}
