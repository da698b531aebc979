package io.entryrender.cli.config;

/**
 * Configuration of the command-line renderer.
 *
 * <p>
 * Use {@link #builder()}; every field except {@code profilePath} has a default.
 *
 * @param profilePath   display profile YAML file, required
 * @param assetBasePath path relative illustration references are rewritten under
 * @param language      language forms are filtered by, or {@code null} for all languages
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record RenderConfig(
        String profilePath, String assetBasePath, String language, String loggingFormat, String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RenderConfig}. */
    public static final class Builder {

        private String profilePath;
        private String assetBasePath = "/static/images/";
        private String language;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder profilePath(String profilePath) {
            this.profilePath = profilePath;
            return this;
        }

        public Builder assetBasePath(String assetBasePath) {
            this.assetBasePath = assetBasePath;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the config.
         *
         * @throws IllegalArgumentException if no profile path is set or the logging format is
         *                                  neither {@code text} nor {@code json}
         */
        public RenderConfig build() {
            if (profilePath == null || profilePath.isBlank()) {
                throw new IllegalArgumentException(
                        "render.profile is required (or set ENTRY_RENDER_PROFILE / --profile)");
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new IllegalArgumentException(
                        "logging.format must be 'text' or 'json', got: '" + loggingFormat + "'");
            }
            return new RenderConfig(profilePath, assetBasePath, language, loggingFormat, loggingLevel);
        }
    }
}
