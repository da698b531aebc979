package io.entryrender.core.error;

/**
 * Thrown by {@code SourceParser} when entry input is not well-formed XML. {@code EntryRenderer}
 * catches it and falls back to fragment recovery, so it never reaches render callers.
 */
public final class SourceParseException extends RenderException {

    private static final long serialVersionUID = 1L;

    public SourceParseException(String message, Throwable cause) {
        super(message, cause, null, Phase.RENDER);
    }
}
