package io.entryrender.core.error;

/**
 * Thrown when a display profile file cannot be read, violates the profile schema, or carries an
 * unknown visibility, mode or aspect value.
 */
public final class ProfileLoadException extends RenderException {

    private static final long serialVersionUID = 1L;

    public ProfileLoadException(String message, String source) {
        super(message, source, Phase.LOAD);
    }

    public ProfileLoadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.LOAD);
    }
}
