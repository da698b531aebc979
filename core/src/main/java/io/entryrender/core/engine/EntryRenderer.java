package io.entryrender.core.engine;

import io.entryrender.core.error.SourceParseException;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.SourceTree;
import io.entryrender.core.spi.LabelResolver;
import io.entryrender.core.spi.RenderListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level entry renderer: turns one entry XML document and an ordered rule list into
 * {@code div}/{@code span} markup.
 *
 * <p>
 * Never throws. Malformed input degrades to recovered text fragments or the empty placeholder;
 * any other failure yields the error placeholder with the failure reason. Each call owns its
 * render state, so one instance serves concurrent callers.
 */
public final class EntryRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(EntryRenderer.class);

    /** Returned when the input yields no content. */
    public static final String EMPTY_PLACEHOLDER = "<div class=\"entry-empty\">No content to display</div>";

    private static final String ERROR_PREFIX = "<div class=\"entry-error\">Error rendering entry: ";

    private final RenderOptions options;
    private final RenderListener listener;
    private final SourceParser parser = new SourceParser();
    private final TreeWalker walker;

    /** Creates a renderer with {@link RenderOptions#DEFAULT}, no label resolver and no listener. */
    public EntryRenderer() {
        this(RenderOptions.DEFAULT);
    }

    public EntryRenderer(RenderOptions options) {
        this(options, LabelResolver.NONE, null);
    }

    /**
     * @param options  renderer options
     * @param labels   resolver for label and abbreviation aspects, or {@code null} for none
     * @param listener observability listener, or {@code null} for none
     */
    public EntryRenderer(RenderOptions options, LabelResolver labels, RenderListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener;
        this.walker = new TreeWalker(new TextExtractor(options, labels));
    }

    /** Renders an entry without a shared category. */
    public String render(String xml, List<RenderRule> rules) {
        return render(xml, rules, null);
    }

    /**
     * Renders an entry.
     *
     * @param xml            entry document, possibly namespaced or malformed
     * @param rules          display rules in listed order
     * @param sharedCategory entry-level grammatical category shown once before the first sense,
     *                       or {@code null}
     * @return markup, never {@code null}
     */
    public String render(String xml, List<RenderRule> rules, String sharedCategory) {
        return doRender(xml, rules, sharedCategory, false);
    }

    /**
     * Renders an entry, using as shared category the grammatical category all of its senses
     * agree on, if any.
     */
    public String renderWithDetectedCategory(String xml, List<RenderRule> rules) {
        return doRender(xml, rules, null, true);
    }

    private String doRender(String xml, List<RenderRule> rules, String sharedCategory, boolean detectCategory) {
        long startNanos = System.nanoTime();
        if (xml == null || xml.isBlank()) {
            return EMPTY_PLACEHOLDER;
        }
        List<RenderRule> ruleList = rules != null ? rules : List.of();
        try {
            SourceTree tree;
            try {
                tree = parser.parse(xml);
            } catch (SourceParseException e) {
                return recover(xml, e, startNanos);
            }

            String category = detectCategory ? CategoryDetector.detect(tree).orElse(null) : sharedCategory;
            RenderContext ctx = RenderContext.create(ruleList, tree.size(), category, options.defaultLanguage());
            String markup = walker.render(tree.root(), ctx, null).trim();

            long durationMs = elapsedMs(startNanos);
            LOG.debug("Rendered entry: {} nodes, {} rules, {} chars in {}ms", tree.size(), ruleList.size(),
                    markup.length(), durationMs);
            notifyCompleted(ruleList.size(), tree.size(), markup.length(), durationMs);
            return markup.isEmpty() ? EMPTY_PLACEHOLDER : markup;
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.warn("Failed to render entry: {}", reason, e);
            notifyFailed(reason, elapsedMs(startNanos));
            return ERROR_PREFIX + Markup.escape(reason) + "</div>";
        }
    }

    private String recover(String xml, SourceParseException cause, long startNanos) {
        List<String> fragments = FragmentRecovery.recover(SourceParser.normalize(xml));
        LOG.warn("Entry is not well-formed, recovered {} text fragment(s): {}", fragments.size(), cause.getMessage());
        notifyRecovered(cause.getMessage(), fragments.size(), elapsedMs(startNanos));
        return fragments.isEmpty() ? EMPTY_PLACEHOLDER : FragmentRecovery.toMarkup(fragments);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never change the returned markup.

    private void notifyCompleted(int ruleCount, int nodeCount, int outputLength, long durationMs) {
        if (listener == null) return;
        try {
            listener.onRenderCompleted(
                    new RenderListener.RenderCompletedEvent(ruleCount, nodeCount, outputLength, durationMs));
        } catch (Exception e) {
            LOG.warn("RenderListener.onRenderCompleted failed", e);
        }
    }

    private void notifyRecovered(String parseError, int fragments, long durationMs) {
        if (listener == null) return;
        try {
            listener.onInputRecovered(new RenderListener.InputRecoveredEvent(parseError, fragments, durationMs));
        } catch (Exception e) {
            LOG.warn("RenderListener.onInputRecovered failed", e);
        }
    }

    private void notifyFailed(String errorDetail, long durationMs) {
        if (listener == null) return;
        try {
            listener.onRenderFailed(new RenderListener.RenderFailedEvent(errorDetail, durationMs));
        } catch (Exception e) {
            LOG.warn("RenderListener.onRenderFailed failed", e);
        }
    }
}
