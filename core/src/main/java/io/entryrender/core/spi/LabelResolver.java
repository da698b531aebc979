package io.entryrender.core.spi;

import io.entryrender.core.model.DisplayAspect;
import java.util.Optional;

/**
 * SPI for turning stored range values (relation types, grammatical categories, trait values)
 * into display labels or abbreviations.
 *
 * <p>
 * Range data lives outside the renderer; hosts plug in a resolver backed by their own range
 * store. The renderer only consults the resolver for rules that set a
 * {@link DisplayAspect#LABEL} or {@link DisplayAspect#ABBR} aspect, and falls back to the stored
 * value when the resolver returns empty.
 */
@FunctionalInterface
public interface LabelResolver {

    /** Resolver that knows no labels; every value is shown as stored. */
    LabelResolver NONE = (rangeId, value, aspect, language) -> Optional.empty();

    /**
     * Looks up the display text for a range value.
     *
     * @param rangeId  the range the value belongs to, e.g. {@code "lexical-relation"},
     *                 {@code "grammatical-info"}, {@code "variant-type"} or a trait name
     * @param value    the stored value
     * @param aspect   {@link DisplayAspect#LABEL} or {@link DisplayAspect#ABBR}
     * @param language the active display language, or {@code null} when unfiltered
     * @return the display text, or empty to keep the stored value
     */
    Optional<String> resolve(String rangeId, String value, DisplayAspect aspect, String language);
}
