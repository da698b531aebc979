package io.entryrender.core.spi;

/**
 * SPI for observability hooks on top-level render calls.
 *
 * <p>
 * Hosts bridge these events to metrics or tracing systems; the core carries no such dependency.
 * All methods receive immutable event objects. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the renderer and logged; they never
 * change the rendered markup.
 */
public interface RenderListener {

    /**
     * Called when an entry was parsed and rendered.
     *
     * @param event contains rule count, output length, duration
     */
    void onRenderCompleted(RenderCompletedEvent event);

    /**
     * Called when an entry was not well-formed and the renderer fell back to fragment recovery.
     *
     * @param event contains the parse error and the number of recovered fragments
     */
    void onInputRecovered(InputRecoveredEvent event);

    /**
     * Called when rendering failed unexpectedly and the error placeholder was returned.
     *
     * @param event contains the failure detail
     */
    void onRenderFailed(RenderFailedEvent event);

    // --- Event records ---

    /** Event emitted after a successful render. */
    record RenderCompletedEvent(int ruleCount, int nodeCount, int outputLength, long durationMs) {}

    /** Event emitted after malformed input was handled by fragment recovery. */
    record InputRecoveredEvent(String parseError, int recoveredFragments, long durationMs) {}

    /** Event emitted when the error placeholder was returned. */
    record RenderFailedEvent(String errorDetail, long durationMs) {}
}
