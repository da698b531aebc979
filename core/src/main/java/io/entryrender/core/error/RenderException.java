package io.entryrender.core.error;

/**
 * Abstract base for all entry-render exceptions. Never thrown directly; use
 * {@link ProfileLoadException} for profile files and {@link SourceParseException} for entry input.
 */
public abstract class RenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        RENDER
    }

    private final String source;
    private final Phase phase;

    protected RenderException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected RenderException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The file, resource or entry that triggered the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
