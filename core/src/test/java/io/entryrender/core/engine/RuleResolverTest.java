package io.entryrender.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RuleResolver")
class RuleResolverTest {

    private static SourceNode relation(String type) {
        return new SourceNode(3, "relation", NodeKind.CROSS_REFERENCE, Map.of("type", type), List.of(), "");
    }

    private static SourceNode note(String type) {
        return new SourceNode(4, "note", NodeKind.CONTENT, Map.of("type", type), List.of(), "");
    }

    private static RenderRule rule(String type, String filter, String cssClass) {
        return RenderRule.builder(type).filter(filter).cssClass(cssClass).build();
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("no candidates → unconfigured")
        void noCandidates() {
            RuleResolver.Resolution resolution = RuleResolver.resolve(note("general"), List.of());

            assertThat(resolution.rule()).isNull();
            assertThat(resolution.excluded()).isFalse();
        }

        @Test
        @DisplayName("matching filtered rule beats an earlier filter-less rule")
        void filteredMatchBeatsFallback() {
            RenderRule plain = rule("relation", null, "plain");
            RenderRule synonyms = rule("relation", "synonym", "synonyms");

            assertThat(RuleResolver.resolve(relation("synonym"), List.of(plain, synonyms)).rule())
                    .isSameAs(synonyms);
        }

        @Test
        @DisplayName("first of several matching filtered rules wins")
        void firstFilteredMatchWins() {
            RenderRule first = rule("relation", "synonym,antonym", "first");
            RenderRule second = rule("relation", "synonym", "second");

            assertThat(RuleResolver.resolve(relation("synonym"), List.of(first, second)).rule())
                    .isSameAs(first);
        }

        @Test
        @DisplayName("no filtered match → first filter-less rule")
        void fallbackToFirstFilterless() {
            RenderRule filtered = rule("relation", "antonym", "antonyms");
            RenderRule plainA = rule("relation", null, "a");
            RenderRule plainB = rule("relation", null, "b");

            assertThat(RuleResolver.resolve(relation("synonym"), List.of(filtered, plainA, plainB)).rule())
                    .isSameAs(plainA);
        }
    }

    @Nested
    @DisplayName("No match")
    class NoMatch {

        @Test
        @DisplayName("cross-reference partitioned by two filtered rules → excluded")
        void partitionedCrossReferenceExcluded() {
            List<RenderRule> rules = List.of(rule("relation", "synonym", "s"), rule("relation", "antonym", "a"));

            RuleResolver.Resolution resolution = RuleResolver.resolve(relation("hypernym"), rules);

            assertThat(resolution.excluded()).isTrue();
            assertThat(resolution.rule()).isNull();
        }

        @Test
        @DisplayName("cross-reference with a single filtered rule → unconfigured, not excluded")
        void singleFilteredRuleFallsBack() {
            RuleResolver.Resolution resolution =
                    RuleResolver.resolve(relation("hypernym"), List.of(rule("relation", "synonym", "s")));

            assertThat(resolution.excluded()).isFalse();
            assertThat(resolution.rule()).isNull();
        }

        @Test
        @DisplayName("other kinds are never excluded")
        void otherKindsFallBack() {
            List<RenderRule> rules = List.of(rule("note", "usage", "u"), rule("note", "grammar", "g"));

            RuleResolver.Resolution resolution = RuleResolver.resolve(note("general"), rules);

            assertThat(resolution.excluded()).isFalse();
            assertThat(resolution.rule()).isNull();
        }
    }
}
